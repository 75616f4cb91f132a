package it.cavallium.cdclistener.core.common;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Session obtained from the login endpoint, attached to every RPC as metadata.
 */
public record SessionCredentials(@NotNull String accessToken, @NotNull String instanceUrl, @Nullable String tenantId) {

	@Override
	public String toString() {
		return "SessionCredentials[instanceUrl=" + instanceUrl + ", tenantId=" + tenantId + "]";
	}
}
