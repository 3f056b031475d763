/**
 * Request correlation for logs.
 *
 * <p>MDC keys used across the service:
 * <ul>
 *   <li>{@code requestId} - per HTTP request or per orchestrator call</li>
 *   <li>{@code tenantId} - calling tenant, when known</li>
 *   <li>{@code operation} - {@code stt} or {@code tts} while a speech request runs</li>
 * </ul>
 *
 * <p>The provider and metrics executors copy the ThreadContext to their worker threads.
 */
package com.phillippitts.voicegate.config.logging;
