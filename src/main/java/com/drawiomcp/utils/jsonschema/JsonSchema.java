package com.drawiomcp.utils.jsonschema;

import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An immutable JSON Schema built with {@link SchemaBuilder}.
 */
public final class JsonSchema {

	private final ObjectNode schemaNode;

	JsonSchema(ObjectNode schemaNode) {
		this.schemaNode = schemaNode;
	}

	/**
	 * Returns the underlying node. Modifications affect this instance.
	 */
	public ObjectNode getNode() {
		return schemaNode;
	}

	/**
	 * Serializes the schema.
	 *
	 * @return the JSON text, or empty if serialization fails
	 */
	public Optional<String> toJsonString(ObjectMapper mapper) {
		if (mapper == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(mapper.writeValueAsString(schemaNode));
		} catch (JsonProcessingException e) {
			return Optional.empty();
		}
	}

	@Override
	public String toString() {
		return schemaNode.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof JsonSchema)) {
			return false;
		}
		return schemaNode.equals(((JsonSchema) o).schemaNode);
	}

	@Override
	public int hashCode() {
		return schemaNode.hashCode();
	}
}
