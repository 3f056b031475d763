/**
 * Exception-to-HTTP mapping for the operational endpoints.
 *
 * <ul>
 *   <li>{@link com.phillippitts.voicegate.exception.ProviderNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.voicegate.exception.InvalidRequestException} → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.voicegate.exception.OrchestratorNotReadyException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "ProviderNotFoundException",
 *   "message": "Provider not found",
 *   "details": "Provider not configured: deepgram",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.voicegate.presentation.exception;
