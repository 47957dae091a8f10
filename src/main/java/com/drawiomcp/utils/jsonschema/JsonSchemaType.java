package com.drawiomcp.utils.jsonschema;

/**
 * JSON Schema primitive types used by tool input schemas.
 */
public enum JsonSchemaType {
	STRING("string"),
	INTEGER("integer"),
	BOOLEAN("boolean"),
	OBJECT("object");

	private final String value;

	JsonSchemaType(String value) {
		this.value = value;
	}

	@Override
	public String toString() {
		return value;
	}
}
