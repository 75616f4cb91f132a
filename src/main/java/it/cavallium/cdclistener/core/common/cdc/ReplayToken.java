package it.cavallium.cdclistener.core.common.cdc;

import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Opaque position in the change feed.
 * The bytes are never parsed or ordered, only stored and sent back to the server.
 */
public final class ReplayToken {

	private final byte[] bytes;

	private ReplayToken(byte[] bytes) {
		this.bytes = bytes;
	}

	/**
	 * @return the token, or null if the bytes are null or empty
	 */
	@Nullable
	public static ReplayToken ofNullable(byte @Nullable [] bytes) {
		if (bytes == null || bytes.length == 0) {
			return null;
		}
		return new ReplayToken(bytes.clone());
	}

	@NotNull
	public static ReplayToken of(byte @NotNull [] bytes) {
		var token = ofNullable(bytes);
		if (token == null) {
			throw new IllegalArgumentException("Replay token must not be empty");
		}
		return token;
	}

	@NotNull
	public static ReplayToken fromBase64(@NotNull String text) {
		return of(Base64.getDecoder().decode(text.trim()));
	}

	public byte[] toByteArray() {
		return bytes.clone();
	}

	public String toBase64() {
		return Base64.getEncoder().encodeToString(bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ReplayToken that)) {
			return false;
		}
		return Arrays.equals(bytes, that.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "0x" + HexFormat.of().formatHex(bytes);
	}
}
