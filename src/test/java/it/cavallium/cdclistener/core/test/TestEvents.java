package it.cavallium.cdclistener.core.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.EncoderFactory;

/**
 * Account change event schema and payloads shaped like the ones published on change data capture channels.
 */
public class TestEvents {

	public static final String SCHEMA_ID = "account-schema-1";

	public static final Schema CHANGE_TYPE_SCHEMA = SchemaBuilder.enumeration("ChangeType")
			.namespace("com.sforce.eventbus")
			.symbols("CREATE", "UPDATE", "DELETE", "UNDELETE", "GAP_CREATE", "GAP_UPDATE", "GAP_DELETE",
					"GAP_UNDELETE", "GAP_OVERFLOW");

	public static final Schema HEADER_SCHEMA = SchemaBuilder.record("ChangeEventHeader")
			.namespace("com.sforce.eventbus")
			.fields()
			.requiredString("entityName")
			.name("recordIds").type().array().items().stringType().noDefault()
			.name("changeType").type(CHANGE_TYPE_SCHEMA).noDefault()
			.requiredLong("commitTimestamp")
			.name("nulledFields").type().array().items().stringType().noDefault()
			.name("diffFields").type().array().items().stringType().noDefault()
			.name("changedFields").type().array().items().stringType().noDefault()
			.endRecord();

	public static final Schema NAME_SCHEMA = SchemaBuilder.record("Name")
			.namespace("com.sforce.eventbus")
			.fields()
			.optionalString("Salutation")
			.optionalString("FirstName")
			.optionalString("LastName")
			.endRecord();

	/**
	 * Fields: 0 ChangeEventHeader, 1 Name, 2 Industry, 3 AnnualRevenue, 4 Active
	 */
	public static final Schema ACCOUNT_SCHEMA = SchemaBuilder.record("AccountChangeEvent")
			.namespace("com.sforce.eventbus")
			.fields()
			.name("ChangeEventHeader").type(HEADER_SCHEMA).noDefault()
			.name("Name").type().optional().type(NAME_SCHEMA)
			.optionalString("Industry")
			.optionalDouble("AnnualRevenue")
			.optionalBoolean("Active")
			.endRecord();

	public static final Schema PLAIN_SCHEMA = SchemaBuilder.record("Order")
			.namespace("com.example")
			.fields()
			.requiredString("orderId")
			.requiredInt("quantity")
			.name("tags").type().array().items().stringType().noDefault()
			.endRecord();

	public static GenericRecord accountUpdate(String industry, List<String> changedFields) {
		var header = new GenericData.Record(HEADER_SCHEMA);
		header.put("entityName", "Account");
		header.put("recordIds", List.of("001RM000003R3aSYAS"));
		header.put("changeType", new GenericData.EnumSymbol(CHANGE_TYPE_SCHEMA, "UPDATE"));
		header.put("commitTimestamp", 1700000000000L);
		header.put("nulledFields", List.of("0x10"));
		header.put("diffFields", List.of());
		header.put("changedFields", changedFields);

		var name = new GenericData.Record(NAME_SCHEMA);
		name.put("FirstName", "Ada");
		name.put("LastName", "Lovelace");

		var account = new GenericData.Record(ACCOUNT_SCHEMA);
		account.put("ChangeEventHeader", header);
		account.put("Name", name);
		account.put("Industry", industry);
		account.put("AnnualRevenue", 1250000.5d);
		account.put("Active", null);
		return account;
	}

	public static byte[] accountUpdatePayload(String industry) {
		return encode(accountUpdate(industry, List.of("0x4", "1-0x6")));
	}

	public static byte[] encode(GenericRecord record) {
		var out = new ByteArrayOutputStream();
		var encoder = EncoderFactory.get().binaryEncoder(out, null);
		try {
			new GenericDatumWriter<GenericRecord>(record.getSchema()).write(record, encoder);
			encoder.flush();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		return out.toByteArray();
	}
}
