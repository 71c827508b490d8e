package works.hydrate.metadata;

import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Fluent front end to {@link MetadataRegistry#register} for the fields of one model class.
 * <p>
 * Each call merges one attribute into the field's current metadata
 * and registers the result, so calls for the same field compose:
 *
 * <pre>
 *  registry.declare(Order.class)
 *      .field("products").dataType(OrderProduct.class, true)
 *      .field("createdDate").dataType(Instant.class).converters(epochSeconds);
 * </pre>
 *
 * Redeclaring an attribute replaces it.
 */
public final class ModelDeclaration {
	private final MetadataRegistry registry;
	private final Class<?> modelType;

	ModelDeclaration(MetadataRegistry registry, Class<?> modelType) {
		this.registry = registry;
		this.modelType = modelType;
	}

	public Class<?> modelType() {
		return modelType;
	}

	public FieldDeclaration field(String fieldName) {
		return new FieldDeclaration(requireNonNull(fieldName));
	}

	public final class FieldDeclaration {
		private final String fieldName;

		private FieldDeclaration(String fieldName) {
			this.fieldName = fieldName;
		}

		public String fieldName() {
			return fieldName;
		}

		/**
		 * @throws IllegalArgumentException if {@code target} is not {@link TargetType#of a valid target}
		 */
		public FieldDeclaration dataType(Class<?> target) {
			return dataType(target, false);
		}

		/**
		 * @throws IllegalArgumentException if {@code target} is not {@link TargetType#of a valid target}
		 */
		public FieldDeclaration dataType(Class<?> target, boolean isArray) {
			TargetType targetType = TargetType.of(target);
			return update(m -> m.withDataType(targetType, isArray));
		}

		/**
		 * @throws works.hydrate.exceptions.SkipConverterConflictException if this field has converters
		 */
		public FieldDeclaration skip() {
			return update(FieldMetadata::withSkip);
		}

		/**
		 * @throws works.hydrate.exceptions.SkipConverterConflictException if this field is skipped
		 */
		public FieldDeclaration converters(ConverterTable converters) {
			requireNonNull(converters);
			return update(m -> m.withConverters(converters));
		}

		/**
		 * Moves on to another field of the same model class.
		 */
		public FieldDeclaration field(String otherField) {
			return ModelDeclaration.this.field(otherField);
		}

		private FieldDeclaration update(UnaryOperator<FieldMetadata> change) {
			FieldMetadata current = registry.declared(modelType, fieldName).orElse(FieldMetadata.NONE);
			registry.register(modelType, fieldName, change.apply(current));
			return this;
		}
	}
}
