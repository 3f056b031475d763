/**
 * Request orchestration: validation, cache lookup and the sequential provider fallback chain with
 * breaker, limiter and retry accounting.
 */
package com.phillippitts.voicegate.service.orchestration;
