package works.hydrate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import works.hydrate.exceptions.ArrayNotExpectedException;
import works.hydrate.exceptions.ExpectedArrayException;
import works.hydrate.exceptions.ExpectedObjectException;
import works.hydrate.exceptions.FieldAssignmentException;
import works.hydrate.exceptions.InvalidDateCastException;
import works.hydrate.exceptions.MissingDataTypeAnnotationException;
import works.hydrate.exceptions.MissingRequiredConverterException;
import works.hydrate.exceptions.ModelInstantiationException;
import works.hydrate.exceptions.UnknownFieldException;
import works.hydrate.metadata.ConverterTable;
import works.hydrate.metadata.FieldMetadata;
import works.hydrate.metadata.MetadataRegistry;
import works.hydrate.metadata.RawType;
import works.hydrate.metadata.TargetType;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.hydrate.Records.array;
import static works.hydrate.Records.record;

class DeserializerTest {
	static final Instant NEW_YEAR_2020 = Instant.parse("2020-01-01T00:00:00Z");
	static final long NEW_YEAR_2020_MILLIS = 1577836800000L;

	MetadataRegistry registry;

	static class Primitives {
		String string;
		Integer number;
		Boolean flag;
		Double fraction;
		Object nothing = "constructor default";
		String untouched = "constructor default";
	}

	static class Envelope {
		Object payload;
	}

	static class Event {
		Instant when;
		Date legacyWhen;
		Object untyped;
	}

	static class Item {
		String name;
		int count;
	}

	static class Basket {
		List<Item> items;
		Item[] itemArray;
		Item favourite;
		long[] counts;
		String label;
	}

	static class Base {
		Item inherited;
	}

	static class Derived extends Base {
		String extra;
	}

	static class NoDefaultConstructor {
		final String name;

		NoDefaultConstructor(String name) {
			this.name = name;
		}
	}

	static class ExplodingConstructor {
		ExplodingConstructor() {
			throw new IllegalStateException("boom");
		}
	}

	@BeforeEach
	void setUp() {
		registry = new MetadataRegistry();
	}

	Deserializer deserializer() {
		return new Deserializer(registry);
	}

	@Test
	void primitiveOnlyRecord_fieldsEqualInput() {
		var raw = record(
			"string", "hello",
			"number", 42,
			"flag", true,
			"fraction", 1.5,
			"nothing", null);
		Primitives actual = deserializer().deserialize(Primitives.class, raw);
		assertEquals("hello", actual.string);
		assertEquals(42, actual.number);
		assertEquals(true, actual.flag);
		assertEquals(1.5, actual.fraction);
		assertNull(actual.nothing);
		assertEquals("constructor default", actual.untouched, "Absent keys leave fields alone");
	}

	@ParameterizedTest
	@MethodSource("payloads")
	void skip_valueIsIdentical(Object payload) {
		registry.declare(Envelope.class).field("payload").skip();
		Envelope actual = deserializer().deserialize(Envelope.class, record("payload", payload));
		assertSame(payload, actual.payload);
	}

	static Stream<Object> payloads() {
		return Stream.of(
			record("nested", record("deeper", array(1, 2))),
			array(record("a", 1), "b", null),
			"text",
			12345L,
			true
		);
	}

	@Test
	void skip_numbersNotAdapted() {
		registry.declare(Item.class).field("count").skip();
		var e = assertThrows(FieldAssignmentException.class, () ->
			deserializer().deserialize(Item.class, record("count", 2.0)));
		assertEquals("count", e.fieldName());
	}

	@Test
	void date_fromStringAndNumber() {
		registry.declare(Event.class).field("when").dataType(Instant.class);
		Deserializer deserializer = deserializer();
		assertEquals(NEW_YEAR_2020, deserializer.deserialize(Event.class, record("when", "2020-01-01T00:00:00Z")).when);
		assertEquals(NEW_YEAR_2020, deserializer.deserialize(Event.class, record("when", NEW_YEAR_2020_MILLIS)).when);
	}

	@Test
	void date_fromBoolean_invalidCast() {
		registry.declare(Event.class).field("when").dataType(Instant.class);
		var e = assertThrows(InvalidDateCastException.class, () ->
			deserializer().deserialize(Event.class, record("when", true)));
		assertEquals(Event.class, e.modelType());
		assertEquals("when", e.fieldName());
		assertEquals("$.when", e.location());
	}

	@Test
	void date_null_staysNull() {
		registry.declare(Event.class).field("when").dataType(Instant.class);
		assertNull(deserializer().deserialize(Event.class, record("when", null)).when);
	}

	@Test
	void date_intoLegacyDateField() {
		registry.declare(Event.class).field("legacyWhen").dataType(Date.class);
		Event actual = deserializer().deserialize(Event.class, record("legacyWhen", NEW_YEAR_2020_MILLIS));
		assertEquals(Date.from(NEW_YEAR_2020), actual.legacyWhen);
	}

	@Test
	void dateConverters_numberOnly() {
		Instant adjusted = NEW_YEAR_2020.minusMillis(1);
		registry.declare(Event.class).field("when")
			.dataType(Instant.class)
			.converters(ConverterTable.of(RawType.NUMBER, raw -> Instant.ofEpochSecond(((Number) raw).longValue()).minusMillis(1)));
		Deserializer deserializer = deserializer();

		var e = assertThrows(MissingRequiredConverterException.class, () ->
			deserializer.deserialize(Event.class, record("when", "2020-01-01T00:00:00Z")));
		assertEquals(RawType.STRING, e.rawType());

		Event actual = deserializer.deserialize(Event.class, record("when", NEW_YEAR_2020.getEpochSecond()));
		assertEquals(adjusted, actual.when);
	}

	@Test
	void dateConverters_resultAssignedExactly() {
		Instant sentinel = Instant.ofEpochSecond(7);
		registry.declare(Event.class).field("when")
			.dataType(Instant.class)
			.converters(ConverterTable.of(RawType.NUMBER, raw -> sentinel));
		assertSame(sentinel, deserializer().deserialize(Event.class, record("when", 1)).when);
	}

	@Test
	void converters_withoutDataType_transformPrimitive() {
		registry.declare(Item.class).field("name")
			.converters(ConverterTable.of(RawType.STRING, raw -> raw.toString().trim()));
		assertEquals("apple", deserializer().deserialize(Item.class, record("name", "  apple ")).name);
	}

	@Test
	void converters_onModelField_takePrecedence() {
		registry.declare(Basket.class).field("favourite")
			.dataType(Item.class)
			.converters(ConverterTable.of(RawType.STRING, raw -> {
				Item item = new Item();
				item.name = raw.toString();
				return item;
			}));
		Basket actual = deserializer().deserialize(Basket.class, record("favourite", "pear"));
		assertEquals("pear", actual.favourite.name);
	}

	@Test
	void arrayField_preservesOrderAndTypes() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		var raw = record("items", array(
			record("name", "a", "count", 1),
			record("name", "b", "count", 2),
			record("name", "c", "count", 3)));
		Basket actual = deserializer().deserialize(Basket.class, raw);
		assertEquals(3, actual.items.size());
		for (int i = 0; i < 3; i++) {
			Item item = actual.items.get(i);
			assertInstanceOf(Item.class, item);
			assertEquals(String.valueOf((char) ('a' + i)), item.name);
			assertEquals(i + 1, item.count);
		}
	}

	@Test
	void arrayField_empty() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		assertEquals(List.of(), deserializer().deserialize(Basket.class, record("items", array())).items);
	}

	@Test
	void arrayField_null_expectedArray() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		var e = assertThrows(ExpectedArrayException.class, () ->
			deserializer().deserialize(Basket.class, record("items", null)));
		assertEquals(Basket.class, e.modelType());
		assertEquals("items", e.fieldName());
		assertEquals(RawType.NULL, e.actualType());
		assertEquals("$.items", e.location());
	}

	@Test
	void arrayField_nonArray_expectedArray() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		var e = assertThrows(ExpectedArrayException.class, () ->
			deserializer().deserialize(Basket.class, record("items", record("name", "a"))));
		assertEquals(Basket.class, e.modelType());
		assertEquals("items", e.fieldName());
		assertEquals(RawType.OBJECT, e.actualType());
	}

	@Test
	void arrayField_nestedArrayElement_arrayNotExpected() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		var e = assertThrows(ArrayNotExpectedException.class, () ->
			deserializer().deserialize(Basket.class, record("items", array(array()))));
		assertEquals("$.items[0]", e.location());
	}

	@Test
	void arrayField_intoJavaArray() {
		registry.declare(Basket.class).field("itemArray").dataType(Item.class, true);
		registry.register(Basket.class, "counts", FieldMetadata.NONE.withDataType(TargetType.ABSENT, true));
		var raw = record(
			"itemArray", array(record("name", "x"), null),
			"counts", array(1, 2L, 3));
		Basket actual = deserializer().deserialize(Basket.class, raw);
		assertEquals(2, actual.itemArray.length);
		assertEquals("x", actual.itemArray[0].name);
		assertNull(actual.itemArray[1]);
		assertArrayEquals(new long[] { 1, 2, 3 }, actual.counts);
	}

	@Test
	void singleField_receivesArray_arrayNotExpected() {
		registry.declare(Basket.class).field("favourite").dataType(Item.class);
		var e = assertThrows(ArrayNotExpectedException.class, () ->
			deserializer().deserialize(Basket.class, record("favourite", array(record("name", "a")))));
		assertEquals(Basket.class, e.modelType());
		assertEquals("favourite", e.fieldName());
	}

	@Test
	void undeclaredField_nestedObject_missingDataType() {
		var e = assertThrows(MissingDataTypeAnnotationException.class, () ->
			deserializer().deserialize(Event.class, record("untyped", record("a", 1))));
		assertEquals(Event.class, e.modelType());
		assertEquals("untyped", e.fieldName());
		assertThat(e.getMessage(), containsString("Event.untyped"));
	}

	@Test
	void undeclaredField_array_missingDataType() {
		assertThrows(MissingDataTypeAnnotationException.class, () ->
			deserializer().deserialize(Event.class, record("untyped", array(1, 2))));
	}

	@Test
	void undeclaredKey_nestedObject_missingDataTypeEvenWithoutField() {
		var e = assertThrows(MissingDataTypeAnnotationException.class, () ->
			deserializer().deserialize(Item.class, record("nonexistent", record())));
		assertEquals("nonexistent", e.fieldName());
	}

	@Test
	void declaredArrayWithoutTarget_structuredElement_missingDataType() {
		registry.register(Envelope.class, "payload",
			FieldMetadata.NONE.withDataType(TargetType.ABSENT, true));
		Deserializer deserializer = deserializer();
		assertEquals(List.of(1, "two"), deserializer.deserialize(Envelope.class, record("payload", array(1, "two"))).payload);
		assertThrows(MissingDataTypeAnnotationException.class, () ->
			deserializer.deserialize(Envelope.class, record("payload", array(record()))));
	}

	@Test
	void nestedModel_nullPassesThrough() {
		registry.declare(Basket.class).field("favourite").dataType(Item.class);
		assertNull(deserializer().deserialize(Basket.class, record("favourite", null)).favourite);
	}

	@Test
	void nestedModel_scalar_expectedObject() {
		registry.declare(Basket.class).field("favourite").dataType(Item.class);
		var e = assertThrows(ExpectedObjectException.class, () ->
			deserializer().deserialize(Basket.class, record("favourite", "pear")));
		assertEquals(Item.class, e.modelType());
		assertEquals(RawType.STRING, e.actualType());
		assertEquals("$.favourite", e.location());
	}

	@Test
	void nestedError_reportsLocation() {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		var raw = record("items", array(
			record("name", "ok"),
			record("name", "bad", "count", record())));
		var e = assertThrows(MissingDataTypeAnnotationException.class, () ->
			deserializer().deserialize(Basket.class, raw));
		assertEquals(Item.class, e.modelType());
		assertEquals("count", e.fieldName());
		assertEquals("$.items[1].count", e.location());
		assertThat(e.getMessage(), containsString("$.items[1].count"));
	}

	@Test
	void inheritedDeclaration_appliesToSubclass() {
		registry.declare(Base.class).field("inherited").dataType(Item.class);
		Derived actual = deserializer().deserialize(Derived.class, record(
			"inherited", record("name", "from parent"),
			"extra", "own"));
		assertEquals("from parent", actual.inherited.name);
		assertEquals("own", actual.extra);
	}

	@Test
	void topLevel_null() {
		assertNull(deserializer().deserialize(Item.class, null));
	}

	@Test
	void topLevel_array_arrayNotExpected() {
		var e = assertThrows(ArrayNotExpectedException.class, () ->
			deserializer().deserialize(Item.class, array(record())));
		assertNull(e.fieldName());
		assertEquals("$", e.location());
	}

	@Test
	void topLevel_scalar_expectedObject() {
		assertThrows(ExpectedObjectException.class, () -> deserializer().deserialize(Item.class, "item"));
	}

	@Test
	void topLevelArray_elementsInOrder() {
		List<Item> actual = deserializer().deserializeArray(Item.class, array(
			record("name", "first"),
			record("name", "second")));
		assertEquals(List.of("first", "second"), actual.stream().map(i -> i.name).toList());
	}

	@Test
	void topLevelArray_nonArray_objectMustBeArray() {
		var e = assertThrows(ExpectedArrayException.class, () ->
			deserializer().deserializeArray(Item.class, record("name", "x")));
		assertNull(e.fieldName());
		assertThat(e.getMessage(), containsString("Object must be array"));
		assertThrows(ExpectedArrayException.class, () -> deserializer().deserializeArray(Item.class, null));
	}

	@Test
	void topLevelArray_nestedArray_arrayNotExpected() {
		var e = assertThrows(ArrayNotExpectedException.class, () ->
			deserializer().deserializeArray(Item.class, array(record(), array())));
		assertEquals("$[1]", e.location());
	}

	@Test
	void numbers_adaptedToFieldType() {
		Item actual = deserializer().deserialize(Item.class, record("count", 7L));
		assertEquals(7, actual.count);
		assertEquals(8, deserializer().deserialize(Item.class, record("count", new BigDecimal("8.000"))).count);
	}

	@Test
	void numbers_lossy_fieldAssignment() {
		var e = assertThrows(FieldAssignmentException.class, () ->
			deserializer().deserialize(Item.class, record("count", 2.5)));
		assertInstanceOf(ArithmeticException.class, e.getCause());
		assertThrows(FieldAssignmentException.class, () ->
			deserializer().deserialize(Item.class, record("count", Long.MAX_VALUE)));
	}

	@Test
	void numbers_adaptationDisabled_mismatchFails() {
		Deserializer strict = new Deserializer(registry, DeserializerSettings.builder()
			.adaptNumbers(false)
			.build());
		assertEquals(3, strict.deserialize(Item.class, record("count", 3)).count);
		assertThrows(FieldAssignmentException.class, () -> strict.deserialize(Item.class, record("count", 3L)));
	}

	@Test
	void nullIntoPrimitive_fieldAssignment() {
		var e = assertThrows(FieldAssignmentException.class, () ->
			deserializer().deserialize(Item.class, record("count", null)));
		assertEquals("count", e.fieldName());
	}

	@Test
	void wrongPrimitiveType_fieldAssignment() {
		assertThrows(FieldAssignmentException.class, () ->
			deserializer().deserialize(Item.class, record("name", 5)));
	}

	@Test
	void unknownField_ignoredByDefault() {
		Item actual = deserializer().deserialize(Item.class, record("name", "a", "colour", "red"));
		assertEquals("a", actual.name);
	}

	@Test
	void unknownField_failMode() {
		Deserializer strict = new Deserializer(registry, DeserializerSettings.builder()
			.unknownFieldMode(DeserializerSettings.UnknownFieldMode.FAIL)
			.build());
		var e = assertThrows(UnknownFieldException.class, () ->
			strict.deserialize(Item.class, record("name", "a", "colour", "red")));
		assertEquals("colour", e.fieldName());
	}

	@Test
	void noDefaultConstructor_instantiationFails() {
		var e = assertThrows(ModelInstantiationException.class, () ->
			deserializer().deserialize(NoDefaultConstructor.class, record("name", "x")));
		assertEquals(NoDefaultConstructor.class, e.modelType());
	}

	@Test
	void constructorThrows_instantiationFails() {
		var e = assertThrows(ModelInstantiationException.class, () ->
			deserializer().deserialize(ExplodingConstructor.class, record()));
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}

	@Test
	void keyOrder_irrelevant() {
		registry.declare(Basket.class)
			.field("favourite").dataType(Item.class)
			.field("items").dataType(Item.class, true);
		Deserializer deserializer = deserializer();
		Basket forward = deserializer.deserialize(Basket.class, record(
			"label", "L", "favourite", record("name", "f"), "items", array(record("name", "i"))));
		Basket backward = deserializer.deserialize(Basket.class, record(
			"items", array(record("name", "i")), "favourite", record("name", "f"), "label", "L"));
		assertEquals(forward.label, backward.label);
		assertEquals(forward.favourite.name, backward.favourite.name);
		assertEquals(forward.items.get(0).name, backward.items.get(0).name);
	}

	@Test
	void eachCall_buildsFreshInstances() {
		registry.declare(Basket.class).field("favourite").dataType(Item.class);
		Deserializer deserializer = deserializer();
		Map<String, Object> raw = record("favourite", record("name", "same"));
		Basket first = deserializer.deserialize(Basket.class, raw);
		Basket second = deserializer.deserialize(Basket.class, raw);
		assertTrue(first != second && first.favourite != second.favourite);
	}

	@Test
	void sharedAcrossThreads() throws Exception {
		registry.declare(Basket.class).field("items").dataType(Item.class, true);
		Deserializer deserializer = deserializer();
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Callable<Basket>> tasks = IntStream.range(0, 64)
				.<Callable<Basket>>mapToObj(i -> () -> deserializer.deserialize(Basket.class, record(
					"label", "basket" + i,
					"items", array(record("name", "item" + i, "count", i)))))
				.toList();
			List<Future<Basket>> results = executor.invokeAll(tasks);
			for (int i = 0; i < results.size(); i++) {
				Basket basket = results.get(i).get();
				assertEquals("basket" + i, basket.label);
				assertEquals(i, basket.items.get(0).count);
			}
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	void constructingDeserializer_freezesRegistry() {
		deserializer();
		assertTrue(registry.isFrozen());
		assertThrows(IllegalStateException.class, () -> registry.declare(Item.class).field("name").skip());
	}
}
