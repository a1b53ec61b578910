////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.asttokens.json;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.asttokens.mark.AstDialect;
import com.tomaszrup.asttokens.text.SourcePosition;

/**
 * Syntax trees exported as JSON, one object per node:
 * <pre>
 * { "_type": "Call", "lineno": 1, "col_offset": 0, "func": { ... }, "args": [ ... ] }
 * </pre>
 * Children are the values of the remaining fields that are objects carrying
 * a {@code _type}, or arrays of them, in field order. Where CPython's field
 * order is not source order, children are reordered: decorators come first,
 * a return annotation precedes the body, dict keys alternate with their
 * values and parameter defaults follow their parameters. Context and
 * operator nodes are skipped. Columns are UTF-8 byte offsets, as in CPython.
 */
public final class JsonTreeDialect implements AstDialect<JsonObject> {
	public static final String TYPE_FIELD = "_type";

	public static final JsonTreeDialect INSTANCE = new JsonTreeDialect();

	private static final Set<String> POSITION_FIELDS = Set.of("lineno", "col_offset", "end_lineno",
			"end_col_offset");

	private static final Set<String> SINGLETON_KINDS = Set.of(
			// contexts
			"Load", "Store", "Del", "AugLoad", "AugStore", "Param",
			// boolean and unary operators
			"And", "Or", "Invert", "Not", "UAdd", "USub",
			// binary operators
			"Add", "Sub", "Mult", "MatMult", "Div", "Mod", "Pow", "LShift", "RShift", "BitOr", "BitXor",
			"BitAnd", "FloorDiv",
			// comparisons
			"Eq", "NotEq", "Lt", "LtE", "Gt", "GtE", "Is", "IsNot", "In", "NotIn");

	private static final Set<String> STATEMENTS = Set.of("FunctionDef", "AsyncFunctionDef", "ClassDef", "Return",
			"Delete", "Assign", "AugAssign", "AnnAssign", "For", "AsyncFor", "While", "If", "With", "AsyncWith",
			"Match", "Raise", "Try", "TryStar", "Assert", "Import", "ImportFrom", "Global", "Nonlocal", "Expr",
			"Pass", "Break", "Continue", "Print", "Exec");

	private static final Set<String> EXPRESSIONS = Set.of("BoolOp", "NamedExpr", "BinOp", "UnaryOp", "Lambda",
			"IfExp", "Dict", "Set", "ListComp", "SetComp", "DictComp", "GeneratorExp", "Await", "Yield", "YieldFrom",
			"Compare", "Call", "FormattedValue", "JoinedStr", "Constant", "Num", "Str", "Bytes", "NameConstant",
			"Ellipsis", "Attribute", "Subscript", "Starred", "Name", "List", "Tuple", "Slice", "Repr");

	private static final Set<String> DECORATED = Set.of("FunctionDef", "AsyncFunctionDef", "ClassDef");

	private JsonTreeDialect() {
	}

	/**
	 * Reads a tree from JSON.
	 *
	 * @throws IllegalArgumentException if the input is not JSON or its root is
	 *                                  not a node
	 */
	public static JsonObject read(Reader reader) {
		JsonElement root;
		try {
			root = JsonParser.parseReader(reader);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException("Malformed syntax tree: " + e.getMessage(), e);
		}
		if (!isNode(root)) {
			throw new IllegalArgumentException("Syntax tree root must be an object with a '" + TYPE_FIELD
					+ "' field, got: " + root);
		}
		return root.getAsJsonObject();
	}

	public static JsonObject read(String json) {
		return read(new StringReader(json));
	}

	@Override
	public String kindName(JsonObject node) {
		return node.get(TYPE_FIELD).getAsString();
	}

	@Override
	public SourcePosition anchor(JsonObject node) {
		Integer line = intField(node, "lineno");
		Integer column = intField(node, "col_offset");
		if (line == null || column == null) {
			return null;
		}
		return new SourcePosition(line, column);
	}

	@Override
	public SourcePosition endAnchor(JsonObject node) {
		Integer line = intField(node, "end_lineno");
		Integer column = intField(node, "end_col_offset");
		if (line == null || column == null) {
			return null;
		}
		return new SourcePosition(line, column);
	}

	@Override
	public JsonObject firstDecorator(JsonObject node) {
		if (!DECORATED.contains(kindName(node))) {
			return null;
		}
		List<JsonObject> decorators = new ArrayList<>();
		addNodes(decorators, node.get("decorator_list"));
		return decorators.isEmpty() ? null : decorators.get(0);
	}

	@Override
	public List<JsonObject> children(JsonObject node) {
		String kind = kindName(node);
		if ("Dict".equals(kind)) {
			return dictChildren(node);
		}
		if ("arguments".equals(kind)) {
			return argumentChildren(node);
		}
		List<JsonObject> children = new ArrayList<>();
		boolean decorated = DECORATED.contains(kind);
		if (decorated) {
			addNodes(children, node.get("decorator_list"));
		}
		for (Map.Entry<String, JsonElement> field : node.entrySet()) {
			String name = field.getKey();
			if (TYPE_FIELD.equals(name) || POSITION_FIELDS.contains(name)
					|| (decorated && ("decorator_list".equals(name) || "returns".equals(name)))) {
				continue;
			}
			addNodes(children, field.getValue());
			// the return annotation precedes the body
			if (decorated && "args".equals(name)) {
				addNodes(children, node.get("returns"));
			}
		}
		return children;
	}

	@Override
	public boolean isStatement(JsonObject node) {
		return STATEMENTS.contains(kindName(node));
	}

	@Override
	public boolean isExpression(JsonObject node) {
		return EXPRESSIONS.contains(kindName(node));
	}

	// keys and values in source order; a null key stands for a ** entry
	private List<JsonObject> dictChildren(JsonObject node) {
		List<JsonObject> keys = new ArrayList<>();
		List<JsonObject> values = new ArrayList<>();
		JsonElement keyArray = node.get("keys");
		JsonElement valueArray = node.get("values");
		if (keyArray != null && keyArray.isJsonArray()) {
			for (JsonElement key : keyArray.getAsJsonArray()) {
				keys.add(isNode(key) ? key.getAsJsonObject() : null);
			}
		}
		if (valueArray != null && valueArray.isJsonArray()) {
			for (JsonElement value : valueArray.getAsJsonArray()) {
				values.add(isNode(value) ? value.getAsJsonObject() : null);
			}
		}
		List<JsonObject> children = new ArrayList<>();
		for (int i = 0; i < Math.max(keys.size(), values.size()); i++) {
			JsonObject key = i < keys.size() ? keys.get(i) : null;
			JsonObject value = i < values.size() ? values.get(i) : null;
			if (key != null && !isSingleton(key)) {
				children.add(key);
			}
			if (value != null && !isSingleton(value)) {
				children.add(value);
			}
		}
		return children;
	}

	// defaults belong to the last positional parameters; kw_defaults pair
	// with kwonlyargs and hold null for parameters without one
	private List<JsonObject> argumentChildren(JsonObject node) {
		List<JsonObject> positional = new ArrayList<>();
		addNodes(positional, node.get("posonlyargs"));
		addNodes(positional, node.get("args"));
		List<JsonObject> defaults = new ArrayList<>();
		addNodes(defaults, node.get("defaults"));

		List<JsonObject> children = new ArrayList<>();
		int firstDefault = positional.size() - defaults.size();
		for (int i = 0; i < positional.size(); i++) {
			children.add(positional.get(i));
			if (i >= firstDefault) {
				children.add(defaults.get(i - firstDefault));
			}
		}
		addNodes(children, node.get("vararg"));
		JsonElement kwOnly = node.get("kwonlyargs");
		JsonElement kwDefaults = node.get("kw_defaults");
		if (kwOnly != null && kwOnly.isJsonArray()) {
			JsonArray names = kwOnly.getAsJsonArray();
			JsonArray values = kwDefaults != null && kwDefaults.isJsonArray() ? kwDefaults.getAsJsonArray()
					: new JsonArray();
			for (int i = 0; i < names.size(); i++) {
				addNodes(children, names.get(i));
				if (i < values.size()) {
					addNodes(children, values.get(i));
				}
			}
		}
		addNodes(children, node.get("kwarg"));
		return children;
	}

	private static void addNodes(List<JsonObject> children, JsonElement value) {
		if (value == null) {
			return;
		}
		if (isNode(value)) {
			JsonObject child = value.getAsJsonObject();
			if (!isSingleton(child)) {
				children.add(child);
			}
		} else if (value.isJsonArray()) {
			JsonArray array = value.getAsJsonArray();
			for (JsonElement element : array) {
				addNodes(children, element);
			}
		}
	}

	private static boolean isNode(JsonElement element) {
		if (element == null || !element.isJsonObject()) {
			return false;
		}
		JsonElement type = element.getAsJsonObject().get(TYPE_FIELD);
		return type != null && type.isJsonPrimitive() && type.getAsJsonPrimitive().isString();
	}

	private static boolean isSingleton(JsonObject node) {
		return SINGLETON_KINDS.contains(node.get(TYPE_FIELD).getAsString());
	}

	private static Integer intField(JsonObject node, String name) {
		JsonElement value = node.get(name);
		if (value == null || !value.isJsonPrimitive()) {
			return null;
		}
		JsonPrimitive primitive = value.getAsJsonPrimitive();
		return primitive.isNumber() ? primitive.getAsInt() : null;
	}
}
