package it.cavallium.cdclistener.core.common.cdc;

/**
 * Where a subscription starts reading the change feed.
 */
public enum SubscriptionMode {
	/**
	 * Only events published after the subscription is opened.
	 */
	LATEST,

	/**
	 * All events still retained by the server.
	 */
	EARLIEST,

	/**
	 * Events after a given {@link ReplayToken}. When no token is available the listener falls back to
	 * {@link #EARLIEST}.
	 */
	CUSTOM
}
