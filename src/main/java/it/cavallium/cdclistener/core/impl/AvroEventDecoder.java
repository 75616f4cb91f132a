package it.cavallium.cdclistener.core.impl;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import it.cavallium.cdclistener.core.common.cdc.ChangeHeader;
import it.cavallium.cdclistener.core.common.cdc.DecodedEvent;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericEnumSymbol;
import org.apache.avro.generic.GenericFixed;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.BinaryDecoder;
import org.apache.avro.io.DecoderFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes Avro binary payloads into plain Java values.
 */
public class AvroEventDecoder implements EventDecoder {

	public static final String CHANGE_EVENT_HEADER_FIELD = "ChangeEventHeader";

	private static final Logger LOG = LoggerFactory.getLogger(AvroEventDecoder.class);

	@Override
	public @NotNull DecodedEvent decode(@NotNull String schemaId, @NotNull Schema schema, byte @NotNull [] payload)
			throws ListenerException {
		if (schema.getType() != Schema.Type.RECORD) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR,
					"Schema " + schemaId + " is not a record schema: " + schema.getType());
		}
		GenericRecord record = readRecord(schemaId, schema, payload);

		var fieldValues = new LinkedHashMap<String, Object>();
		ChangeHeader changeHeader = null;
		for (Schema.Field field : schema.getFields()) {
			Object value = record.get(field.pos());
			if (CHANGE_EVENT_HEADER_FIELD.equals(field.name())) {
				if (value instanceof GenericRecord headerRecord) {
					changeHeader = readChangeHeader(schema, headerRecord);
				}
			} else {
				fieldValues.put(field.name(), toJavaValue(value));
			}
		}
		if (changeHeader != null && LOG.isDebugEnabled()) {
			LOG.debug("Decoded {} change of {} with changed fields {}", changeHeader.changeType(),
					changeHeader.entityName(), changeHeader.changedFields());
		}
		return new DecodedEvent(schemaId, fieldValues, changeHeader);
	}

	private static GenericRecord readRecord(String schemaId, Schema schema, byte[] payload) {
		try {
			BinaryDecoder decoder = DecoderFactory.get().binaryDecoder(payload, null);
			var record = new GenericDatumReader<GenericRecord>(schema).read(null, decoder);
			if (!decoder.isEnd()) {
				throw new IOException("Trailing bytes after the record");
			}
			return record;
		} catch (IOException | RuntimeException ex) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR,
					"Payload of " + payload.length + " bytes does not match schema " + schemaId, ex);
		}
	}

	private static ChangeHeader readChangeHeader(Schema eventSchema, GenericRecord header) {
		Object changeType = fieldOf(header, "changeType");
		Object commitTimestamp = fieldOf(header, "commitTimestamp");
		return new ChangeHeader(changeType != null ? changeType.toString() : "",
				stringOf(fieldOf(header, "entityName")),
				stringListOf(fieldOf(header, "recordIds")),
				commitTimestamp instanceof Number number ? number.longValue() : null,
				ChangedFieldsBitmap.fieldNames(eventSchema, stringListOf(fieldOf(header, "changedFields"))),
				ChangedFieldsBitmap.fieldNames(eventSchema, stringListOf(fieldOf(header, "nulledFields"))),
				ChangedFieldsBitmap.fieldNames(eventSchema, stringListOf(fieldOf(header, "diffFields")))
		);
	}

	@Nullable
	private static Object fieldOf(GenericRecord record, String name) {
		var field = record.getSchema().getField(name);
		return field != null ? record.get(field.pos()) : null;
	}

	@Nullable
	private static String stringOf(@Nullable Object value) {
		return value != null ? value.toString() : null;
	}

	private static List<String> stringListOf(@Nullable Object value) {
		if (!(value instanceof Collection<?> collection)) {
			return List.of();
		}
		var result = new ArrayList<String>(collection.size());
		for (Object item : collection) {
			if (item != null) {
				result.add(item.toString());
			}
		}
		return result;
	}

	@Nullable
	static Object toJavaValue(@Nullable Object value) {
		if (value == null) {
			return null;
		} else if (value instanceof CharSequence charSequence) {
			return charSequence.toString();
		} else if (value instanceof ByteBuffer byteBuffer) {
			var duplicate = byteBuffer.duplicate();
			var bytes = new byte[duplicate.remaining()];
			duplicate.get(bytes);
			return bytes;
		} else if (value instanceof GenericFixed fixed) {
			return fixed.bytes().clone();
		} else if (value instanceof GenericEnumSymbol<?> symbol) {
			return symbol.toString();
		} else if (value instanceof GenericRecord record) {
			var map = new LinkedHashMap<String, Object>();
			for (Schema.Field field : record.getSchema().getFields()) {
				map.put(field.name(), toJavaValue(record.get(field.pos())));
			}
			return map;
		} else if (value instanceof Map<?, ?> avroMap) {
			var map = new LinkedHashMap<String, Object>();
			avroMap.forEach((k, v) -> map.put(String.valueOf(k), toJavaValue(v)));
			return map;
		} else if (value instanceof Collection<?> collection) {
			var list = new ArrayList<>(collection.size());
			for (Object item : collection) {
				list.add(toJavaValue(item));
			}
			return list;
		} else {
			return value;
		}
	}
}
