/**
 * REST controllers for the operational endpoints.
 *
 * <ul>
 *   <li>{@code GET /providers/health[?name=]} - breaker state and probe results per provider</li>
 *   <li>{@code GET /providers/stats[?provider=&day=]} - daily success rate, latency and volume</li>
 * </ul>
 *
 * @see com.phillippitts.voicegate.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.voicegate.presentation.controller;
