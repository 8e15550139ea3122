package com.eyelevel.uploadengine.event;

/**
 * Published when traffic moves from one provider to another, either because an upload succeeded
 * on a fallback provider or because an operator triggered the switch.
 *
 * @param requestId      the upload that failed over, {@code null} for a manual failover.
 * @param fromProviderId the provider that was abandoned.
 * @param toProviderId   the provider that took over.
 */
public record ProviderFailoverEvent(String requestId, String fromProviderId, String toProviderId) {
}
