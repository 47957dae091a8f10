package com.drawiomcp.utils.jsonschema;

import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Fluent builder for the JSON Schemas advertised as tool inputs.
 *
 * <pre>{@code
 * JsonSchema schema = SchemaBuilder.object(mapper)
 * 		.property("file_path", SchemaBuilder.string(mapper).description("Path to the .drawio file"))
 * 		.property("limit", SchemaBuilder.integer(mapper).minimum(1).maximum(1000))
 * 		.requiredProperty("file_path")
 * 		.build();
 * }</pre>
 */
public final class SchemaBuilder {

	private static final String TYPE = "type";
	private static final String DESCRIPTION = "description";
	private static final String ENUM = "enum";
	private static final String DEFAULT = "default";
	private static final String PROPERTIES = "properties";
	private static final String REQUIRED = "required";
	private static final String ADDITIONAL_PROPERTIES = "additionalProperties";
	private static final String MINIMUM = "minimum";
	private static final String MAXIMUM = "maximum";
	private static final String MIN_LENGTH = "minLength";

	private SchemaBuilder() {
	}

	/** Common surface of every typed builder. */
	public interface IBuildableSchemaType {
		ObjectNode node();

		default JsonSchema build() {
			return new JsonSchema(node());
		}
	}

	public interface IStringSchemaBuilder extends IBuildableSchemaType {
		IStringSchemaBuilder description(String description);

		IStringSchemaBuilder enumValues(String... values);

		IStringSchemaBuilder minLength(int minLength);

		IStringSchemaBuilder defaultValue(String value);
	}

	public interface IIntegerSchemaBuilder extends IBuildableSchemaType {
		IIntegerSchemaBuilder description(String description);

		IIntegerSchemaBuilder minimum(long minimum);

		IIntegerSchemaBuilder maximum(long maximum);

		IIntegerSchemaBuilder defaultValue(long value);
	}

	public interface IObjectSchemaBuilder extends IBuildableSchemaType {
		IObjectSchemaBuilder description(String description);

		IObjectSchemaBuilder property(String name, IBuildableSchemaType schema);

		IObjectSchemaBuilder requiredProperty(String name);

		IObjectSchemaBuilder additionalProperties(boolean allowed);
	}

	public static IStringSchemaBuilder string(ObjectMapper mapper) {
		return new StringBuilderImpl(mapper);
	}

	public static IIntegerSchemaBuilder integer(ObjectMapper mapper) {
		return new IntegerBuilderImpl(mapper);
	}

	public static IObjectSchemaBuilder object(ObjectMapper mapper) {
		return new ObjectBuilderImpl(mapper);
	}

	private abstract static class AbstractSchemaBuilderImpl {
		protected final ObjectMapper mapper;
		protected final ObjectNode schema;

		AbstractSchemaBuilderImpl(JsonSchemaType type, ObjectMapper mapper) {
			this.mapper = Objects.requireNonNull(mapper, "mapper");
			this.schema = mapper.createObjectNode();
			this.schema.put(TYPE, type.toString());
		}

		public ObjectNode node() {
			return schema;
		}
	}

	private static final class StringBuilderImpl extends AbstractSchemaBuilderImpl implements IStringSchemaBuilder {
		StringBuilderImpl(ObjectMapper mapper) {
			super(JsonSchemaType.STRING, mapper);
		}

		@Override
		public IStringSchemaBuilder description(String description) {
			schema.put(DESCRIPTION, description);
			return this;
		}

		@Override
		public IStringSchemaBuilder enumValues(String... values) {
			ArrayNode array = schema.putArray(ENUM);
			for (String value : values) {
				array.add(value);
			}
			return this;
		}

		@Override
		public IStringSchemaBuilder minLength(int minLength) {
			schema.put(MIN_LENGTH, minLength);
			return this;
		}

		@Override
		public IStringSchemaBuilder defaultValue(String value) {
			schema.put(DEFAULT, value);
			return this;
		}
	}

	private static final class IntegerBuilderImpl extends AbstractSchemaBuilderImpl
			implements IIntegerSchemaBuilder {
		IntegerBuilderImpl(ObjectMapper mapper) {
			super(JsonSchemaType.INTEGER, mapper);
		}

		@Override
		public IIntegerSchemaBuilder description(String description) {
			schema.put(DESCRIPTION, description);
			return this;
		}

		@Override
		public IIntegerSchemaBuilder minimum(long minimum) {
			schema.put(MINIMUM, minimum);
			return this;
		}

		@Override
		public IIntegerSchemaBuilder maximum(long maximum) {
			schema.put(MAXIMUM, maximum);
			return this;
		}

		@Override
		public IIntegerSchemaBuilder defaultValue(long value) {
			schema.put(DEFAULT, value);
			return this;
		}
	}

	private static final class ObjectBuilderImpl extends AbstractSchemaBuilderImpl implements IObjectSchemaBuilder {
		ObjectBuilderImpl(ObjectMapper mapper) {
			super(JsonSchemaType.OBJECT, mapper);
		}

		@Override
		public IObjectSchemaBuilder description(String description) {
			schema.put(DESCRIPTION, description);
			return this;
		}

		@Override
		public IObjectSchemaBuilder property(String name, IBuildableSchemaType propertySchema) {
			ObjectNode properties = schema.has(PROPERTIES) ? (ObjectNode) schema.get(PROPERTIES)
					: schema.putObject(PROPERTIES);
			properties.set(name, propertySchema.node());
			return this;
		}

		@Override
		public IObjectSchemaBuilder requiredProperty(String name) {
			ArrayNode required = schema.has(REQUIRED) ? (ArrayNode) schema.get(REQUIRED) : schema.putArray(REQUIRED);
			required.add(name);
			return this;
		}

		@Override
		public IObjectSchemaBuilder additionalProperties(boolean allowed) {
			schema.put(ADDITIONAL_PROPERTIES, allowed);
			return this;
		}
	}
}
