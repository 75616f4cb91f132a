package it.cavallium.cdclistener.core.common;

public class ListenerException extends RuntimeException {

	private final ListenerErrorType errorUniqueId;

	public enum ListenerErrorType {
		AUTH_ERROR,
		TRANSPORT_ERROR,
		IDLE_TIMEOUT,
		SCHEMA_FETCH_ERROR,
		DECODE_ERROR,
		CHECKPOINT_READ_ERROR,
		CHECKPOINT_WRITE_ERROR,
		HEARTBEAT_WRITE_ERROR,
		TOPIC_NOT_SUBSCRIBABLE,
		CONFIG_ERROR
	}

	public static ListenerException of(ListenerErrorType errorUniqueId, String message) {
		return new ListenerException(errorUniqueId, message);
	}

	public static ListenerException of(ListenerErrorType errorUniqueId, Throwable ex) {
		return new ListenerException(errorUniqueId, ex);
	}

	public static ListenerException of(ListenerErrorType errorUniqueId, String message, Throwable ex) {
		return new ListenerException(errorUniqueId, message, ex);
	}

	private ListenerException(ListenerErrorType errorUniqueId, String message) {
		super(message);
		this.errorUniqueId = errorUniqueId;
	}

	private ListenerException(ListenerErrorType errorUniqueId, String message, Throwable ex) {
		super(message, ex);
		this.errorUniqueId = errorUniqueId;
	}

	private ListenerException(ListenerErrorType errorUniqueId, Throwable ex) {
		super(ex.toString(), ex);
		this.errorUniqueId = errorUniqueId;
	}

	public ListenerErrorType getErrorUniqueId() {
		return errorUniqueId;
	}

	@Override
	public String getLocalizedMessage() {
		return "ListenerError: [uid:" + errorUniqueId + "] " + getMessage();
	}
}
