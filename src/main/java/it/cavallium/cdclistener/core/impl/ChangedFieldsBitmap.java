package it.cavallium.cdclistener.core.impl;

import it.cavallium.cdclistener.core.common.ListenerException;
import it.cavallium.cdclistener.core.common.ListenerException.ListenerErrorType;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Interprets the field bitmaps of a change event header.
 * <p>
 * A top-level bitmap has the form {@code 0x<hex>}: bit <i>i</i>, counted from the least significant bit, is set
 * when the <i>i</i>-th field of the record schema is listed. A nested bitmap has the form
 * {@code <parentIndex>-0x<hex>} and addresses the fields of the compound field at {@code parentIndex}; its fields
 * are reported as {@code Parent.Child}, or as {@code Parent} alone when every child is listed.
 */
public final class ChangedFieldsBitmap {

	private static final String HEX_PREFIX = "0x";

	private ChangedFieldsBitmap() {
	}

	@NotNull
	public static Set<String> fieldNames(@NotNull Schema recordSchema, @Nullable List<String> bitmaps) {
		var result = new LinkedHashSet<String>();
		if (bitmaps == null) {
			return result;
		}
		for (String bitmap : bitmaps) {
			if (bitmap == null || bitmap.isBlank()) {
				continue;
			}
			if (bitmap.startsWith(HEX_PREFIX)) {
				result.addAll(fieldNamesOfBitmap(recordSchema, bitmap));
			} else {
				result.addAll(nestedFieldNames(recordSchema, bitmap));
			}
		}
		return result;
	}

	private static List<String> nestedFieldNames(Schema recordSchema, String bitmap) {
		int separator = bitmap.indexOf('-');
		if (separator <= 0) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR, "Invalid field bitmap: " + bitmap);
		}
		int parentIndex;
		try {
			parentIndex = Integer.parseInt(bitmap.substring(0, separator));
		} catch (NumberFormatException ex) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR, "Invalid field bitmap: " + bitmap, ex);
		}
		var fields = recordSchema.getFields();
		if (parentIndex < 0 || parentIndex >= fields.size()) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR,
					"Bitmap " + bitmap + " addresses field " + parentIndex + " but the schema has " + fields.size());
		}
		Field parentField = fields.get(parentIndex);
		Schema childSchema = recordOf(parentField.schema());
		if (childSchema == null) {
			// Not a compound field
			return List.of();
		}
		var childNames = fieldNamesOfBitmap(childSchema, bitmap.substring(separator + 1));
		if (childNames.isEmpty()) {
			return List.of();
		}
		if (childNames.size() == childSchema.getFields().size()) {
			return List.of(parentField.name());
		}
		var result = new ArrayList<String>(childNames.size());
		for (String childName : childNames) {
			result.add(parentField.name() + "." + childName);
		}
		return result;
	}

	private static List<String> fieldNamesOfBitmap(Schema recordSchema, String bitmap) {
		if (!bitmap.startsWith(HEX_PREFIX)) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR, "Invalid field bitmap: " + bitmap);
		}
		var hex = bitmap.substring(HEX_PREFIX.length());
		if (hex.isEmpty()) {
			return List.of();
		}
		BigInteger bits;
		try {
			bits = new BigInteger(hex, 16);
		} catch (NumberFormatException ex) {
			throw ListenerException.of(ListenerErrorType.DECODE_ERROR, "Invalid field bitmap: " + bitmap, ex);
		}
		var fields = recordSchema.getFields();
		var result = new ArrayList<String>(bits.bitCount());
		for (int i = 0; i < bits.bitLength(); i++) {
			if (bits.testBit(i)) {
				if (i >= fields.size()) {
					throw ListenerException.of(ListenerErrorType.DECODE_ERROR,
							"Bitmap " + bitmap + " sets bit " + i + " but the schema has " + fields.size() + " fields");
				}
				result.add(fields.get(i).name());
			}
		}
		return result;
	}

	@Nullable
	private static Schema recordOf(Schema schema) {
		return switch (schema.getType()) {
			case RECORD -> schema;
			case UNION -> {
				for (Schema type : schema.getTypes()) {
					if (type.getType() == Schema.Type.RECORD) {
						yield type;
					}
				}
				yield null;
			}
			default -> null;
		};
	}
}
