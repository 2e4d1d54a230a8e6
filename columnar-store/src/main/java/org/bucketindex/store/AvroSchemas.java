package org.bucketindex.store;

import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.bucketindex.core.model.Bucket;
import org.bucketindex.core.model.BucketType;
import org.bucketindex.core.model.ColumnNames;
import org.bucketindex.core.model.SchemaException;

import java.util.List;
import java.util.Set;

/**
 * Avro record schemas for stored indexes: a required {@code long} id followed by one field per
 * bucket, {@code boolean} for single buckets and {@code array<string>} for multi buckets.
 */
final class AvroSchemas {
	static final String RECORD_NAME = "BucketRow";
	static final String NAMESPACE = "org.bucketindex.store";

	private AvroSchemas() {}

	static Schema forColumns(List<String> columnNames) throws SchemaException {
		if (columnNames.isEmpty() || !ColumnNames.isIdColumn(columnNames.get(0))) {
			throw new SchemaException("Schema must start with " + ColumnNames.ID_COLUMN + ": " + columnNames);
		}

		SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME)
				.namespace(NAMESPACE)
				.fields()
				.requiredLong(ColumnNames.ID_COLUMN);
		for (String name : columnNames.subList(1, columnNames.size())) {
			Bucket bucket = ColumnNames.decode(name);
			if (bucket.type() == BucketType.SINGLE) {
				fields = fields.requiredBoolean(name);
			} else {
				fields = fields.name(name).type().array().items().stringType().noDefault();
			}
		}
		return fields.endRecord();
	}

	/**
	 * The id field plus the fields named in {@code columns}, in file order.
	 */
	static Schema project(Schema file, Set<String> columns) throws SchemaException {
		SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(file.getName())
				.namespace(file.getNamespace())
				.fields();
		for (String column : columns) {
			if (file.getField(column) == null) {
				throw new SchemaException("Column " + column + " is not stored in this index");
			}
		}
		for (Schema.Field field : file.getFields()) {
			if (ColumnNames.isIdColumn(field.name()) || columns.contains(field.name())) {
				fields = fields.name(field.name()).type(field.schema()).noDefault();
			}
		}
		return fields.endRecord();
	}
}
