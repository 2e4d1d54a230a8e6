package org.bucketindex.store;

import org.apache.avro.Schema;
import org.bucketindex.core.model.Bucket;
import org.bucketindex.core.model.BucketPlan;
import org.bucketindex.core.model.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AvroSchemasTest {

	@Test
	public void testFieldTypesFollowBucketTypes() throws Exception {
		BucketPlan plan = new BucketPlan(List.of(Bucket.single("apple"), Bucket.multi("apple"), Bucket.multi("kiwi")));
		List<String> names = plan.columnNames();

		Schema schema = AvroSchemas.forColumns(names);

		assertEquals(Schema.Type.LONG, schema.getField(names.get(0)).schema().getType());
		assertEquals(Schema.Type.BOOLEAN, schema.getField(names.get(1)).schema().getType());
		assertEquals(Schema.Type.ARRAY, schema.getField(names.get(2)).schema().getType());
		assertEquals(Schema.Type.STRING, schema.getField(names.get(3)).schema().getElementType().getType());
	}

	@Test
	public void testProjectionKeepsIdAndFileOrder() throws Exception {
		BucketPlan plan = new BucketPlan(List.of(Bucket.multi("a"), Bucket.single("m"), Bucket.multi("m")));
		List<String> names = plan.columnNames();
		Schema schema = AvroSchemas.forColumns(names);

		Schema projected = AvroSchemas.project(schema, Set.of(names.get(3), names.get(1)));

		assertEquals(List.of(names.get(0), names.get(1), names.get(3)),
				projected.getFields().stream().map(Schema.Field::name).toList());
	}

	@Test
	public void testSchemaWithoutIdIsRejected() {
		assertThrows(SchemaException.class, () -> AvroSchemas.forColumns(List.of("k_abcd1")));
	}
}
