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
package com.tomaszrup.asttokens.python;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.tomaszrup.asttokens.tokens.TokenInfo;
import com.tomaszrup.asttokens.tokens.TokenType;

/**
 * Recursive-descent parser for Python 3 producing {@link PyNode} trees shaped
 * and positioned like those of CPython's {@code ast} module.
 *
 * <p>A node's position is the start of the syntax that produced it, which
 * includes the parentheses around its leftmost operand: in {@code (a) + b}
 * the binary operation starts at column 0 while {@code a} starts at column
 * 1. A parenthesized single expression keeps its own position, but a
 * parenthesized tuple or generator expression starts at its {@code (}.
 * Columns are UTF-8 byte offsets. Constants are reported with the kinds
 * {@code Num}, {@code Str}, {@code Bytes}, {@code JoinedStr},
 * {@code NameConstant} and {@code Ellipsis}.</p>
 *
 * <p>Chains of binary operators are built in loops, so that long chains such
 * as {@code 'a' + 'b' + ... + 'z'} do not deepen the parser's call stack.
 * Instances are stateless.</p>
 */
public class PythonParser {
	private static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async",
			"await", "break", "class", "continue", "def", "del", "elif", "else", "except", "finally", "for", "from",
			"global", "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try",
			"while", "with", "yield");
	private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of("+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=",
			"|=", "^=", ">>=", "<<=", "**=");
	private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

	// binary operator levels, loosest first
	private static final String[][] BINARY_OPERATORS = { { "|" }, { "^" }, { "&" }, { "<<", ">>" }, { "+", "-" },
			{ "*", "@", "/", "%", "//" } };

	private final PythonTokenizer tokenizer = new PythonTokenizer();

	/**
	 * Parses a module.
	 *
	 * @throws PythonSyntaxException if the text is not valid Python
	 */
	public PyNode parse(String text) {
		return new Run(text, tokenizer.tokenize(text)).module();
	}

	/**
	 * Parses a single expression (possibly a tuple without parentheses), such
	 * as the argument of {@code eval()}.
	 *
	 * @throws PythonSyntaxException if the text is not a valid expression
	 */
	public PyNode parseExpression(String text) {
		return new Run(text, tokenizer.tokenize(text)).expression();
	}

	static String operatorName(String operator) {
		switch (operator) {
			case "|":
				return "BitOr";
			case "^":
				return "BitXor";
			case "&":
				return "BitAnd";
			case "<<":
				return "LShift";
			case ">>":
				return "RShift";
			case "+":
				return "Add";
			case "-":
				return "Sub";
			case "*":
				return "Mult";
			case "@":
				return "MatMult";
			case "/":
				return "Div";
			case "%":
				return "Mod";
			case "//":
				return "FloorDiv";
			case "**":
				return "Pow";
			default:
				throw new IllegalArgumentException("Not a binary operator: " + operator);
		}
	}

	private static String comparisonName(String operator) {
		switch (operator) {
			case "<":
				return "Lt";
			case ">":
				return "Gt";
			case "==":
				return "Eq";
			case ">=":
				return "GtE";
			case "<=":
				return "LtE";
			case "!=":
				return "NotEq";
			default:
				throw new IllegalArgumentException("Not a comparison: " + operator);
		}
	}

	/** Parser state for one text. */
	private static final class Run {
		private final List<String> lines;
		private final List<TokenInfo> tokens = new ArrayList<>();
		// first token of the syntax of an expression, parentheses included
		private final Map<PyNode, TokenInfo> starts = new IdentityHashMap<>();
		private int pos;

		Run(String text, List<TokenInfo> allTokens) {
			this.lines = PythonTokenizer.splitLines(text);
			for (TokenInfo token : allTokens) {
				if (token.getType() == TokenType.ERRORTOKEN) {
					throw error("invalid character '" + token.getString() + "'", token);
				}
				if (!token.getType().isNonCoding()) {
					tokens.add(token);
				}
			}
		}

		// ---- token access -------------------------------------------------

		private TokenInfo peek() {
			return peek(0);
		}

		private TokenInfo peek(int ahead) {
			return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
		}

		private TokenInfo next() {
			TokenInfo token = peek();
			if (pos < tokens.size() - 1) {
				pos++;
			}
			return token;
		}

		private boolean check(TokenType type) {
			return peek().getType() == type;
		}

		private boolean checkOp(String op) {
			return isOp(peek(), op);
		}

		private boolean checkKeyword(String keyword) {
			return isKeyword(peek(), keyword);
		}

		private static boolean isOp(TokenInfo token, String op) {
			return token.getType() == TokenType.OP && token.getString().equals(op);
		}

		private static boolean isKeyword(TokenInfo token, String keyword) {
			return token.getType() == TokenType.NAME && token.getString().equals(keyword);
		}

		private boolean acceptOp(String op) {
			if (checkOp(op)) {
				next();
				return true;
			}
			return false;
		}

		private boolean acceptKeyword(String keyword) {
			if (checkKeyword(keyword)) {
				next();
				return true;
			}
			return false;
		}

		private TokenInfo expectOp(String op) {
			if (!checkOp(op)) {
				throw error("expected '" + op + "'", peek());
			}
			return next();
		}

		private TokenInfo expectKeyword(String keyword) {
			if (!checkKeyword(keyword)) {
				throw error("expected '" + keyword + "'", peek());
			}
			return next();
		}

		private TokenInfo expect(TokenType type) {
			if (!check(type)) {
				throw error("expected " + type, peek());
			}
			return next();
		}

		private TokenInfo expectName() {
			TokenInfo token = peek();
			if (token.getType() != TokenType.NAME || KEYWORDS.contains(token.getString())) {
				throw error("expected a name", token);
			}
			return next();
		}

		private static PythonSyntaxException error(String message, TokenInfo token) {
			String near = token.getType() == TokenType.ENDMARKER ? "end of input" : "'" + token.getString() + "'";
			return new PythonSyntaxException("invalid syntax: " + message + " near " + near,
					token.getStart().getLine(), token.getStart().getColumn());
		}

		// ---- node construction --------------------------------------------

		private PyNode node(String kind, TokenInfo anchor) {
			PyNode node = PyNode.of(kind, anchor.getStart().getLine(), utf8Column(anchor));
			starts.put(node, anchor);
			return node;
		}

		private PyNode leaf(String kind, String value, TokenInfo anchor) {
			PyNode node = PyNode.leaf(kind, value, anchor.getStart().getLine(), utf8Column(anchor));
			starts.put(node, anchor);
			return node;
		}

		private TokenInfo start(PyNode node) {
			return starts.get(node);
		}

		private int utf8Column(TokenInfo token) {
			int line = token.getStart().getLine();
			if (line > lines.size()) {
				return 0;
			}
			String lineText = lines.get(line - 1);
			int bytes = 0;
			int index = 0;
			for (int column = 0; column < token.getStart().getColumn() && index < lineText.length(); column++) {
				int codePoint = lineText.codePointAt(index);
				bytes += codePoint < 0x80 ? 1 : codePoint < 0x800 ? 2 : codePoint < 0x10000 ? 3 : 4;
				index += Character.charCount(codePoint);
			}
			return bytes;
		}

		private static void setContext(PyNode target, String context) {
			Deque<PyNode> stack = new ArrayDeque<>();
			stack.push(target);
			while (!stack.isEmpty()) {
				PyNode node = stack.pop();
				node.setContext(context);
				String kind = node.getKind();
				if ("Tuple".equals(kind) || "List".equals(kind) || "Starred".equals(kind)) {
					for (PyNode child : node.getChildren()) {
						if (!child.isMarker()) {
							stack.push(child);
						}
					}
				}
			}
		}

		// ---- statements ---------------------------------------------------

		PyNode module() {
			PyNode module = PyNode.unpositioned("Module");
			while (!check(TokenType.ENDMARKER)) {
				if (check(TokenType.NEWLINE)) {
					next();
					continue;
				}
				module.addAll(statement());
			}
			return module;
		}

		PyNode expression() {
			while (check(TokenType.NEWLINE)) {
				next();
			}
			PyNode expression = testListStarExpr();
			while (check(TokenType.NEWLINE) || check(TokenType.DEDENT)) {
				next();
			}
			expect(TokenType.ENDMARKER);
			return expression;
		}

		private List<PyNode> statement() {
			TokenInfo token = peek();
			if (token.getType() == TokenType.INDENT) {
				throw error("unexpected indent", token);
			}
			if (isOp(token, "@")) {
				return List.of(decorated());
			}
			if (token.getType() == TokenType.NAME) {
				switch (token.getString()) {
					case "if":
						return List.of(ifStatement());
					case "while":
						return List.of(whileStatement());
					case "for":
						return List.of(forStatement(null));
					case "try":
						return List.of(tryStatement());
					case "with":
						return List.of(withStatement(null));
					case "def":
						return List.of(functionDef(new ArrayList<>(), null));
					case "class":
						return List.of(classDef(new ArrayList<>()));
					case "async":
						return List.of(asyncStatement());
					default:
						break;
				}
			}
			return simpleStatements();
		}

		private List<PyNode> simpleStatements() {
			List<PyNode> statements = new ArrayList<>();
			statements.add(smallStatement());
			while (acceptOp(";")) {
				if (check(TokenType.NEWLINE) || check(TokenType.ENDMARKER)) {
					break;
				}
				statements.add(smallStatement());
			}
			if (!check(TokenType.ENDMARKER)) {
				expect(TokenType.NEWLINE);
			}
			return statements;
		}

		private boolean atStatementEnd() {
			return check(TokenType.NEWLINE) || check(TokenType.ENDMARKER) || checkOp(";");
		}

		private PyNode smallStatement() {
			TokenInfo token = peek();
			if (token.getType() == TokenType.NAME) {
				switch (token.getString()) {
					case "pass":
						return node("Pass", next());
					case "break":
						return node("Break", next());
					case "continue":
						return node("Continue", next());
					case "return": {
						PyNode node = node("Return", next());
						if (!atStatementEnd()) {
							node.add(testListStarExpr());
						}
						return node;
					}
					case "del":
						return deleteStatement();
					case "raise": {
						PyNode node = node("Raise", next());
						if (!atStatementEnd()) {
							node.add(test());
							if (acceptKeyword("from")) {
								node.add(test());
							}
						}
						return node;
					}
					case "global":
					case "nonlocal": {
						PyNode node = node("global".equals(token.getString()) ? "Global" : "Nonlocal", next());
						expectName();
						while (acceptOp(",")) {
							expectName();
						}
						return node;
					}
					case "assert": {
						PyNode node = node("Assert", next());
						node.add(test());
						if (acceptOp(",")) {
							node.add(test());
						}
						return node;
					}
					case "import":
						return importStatement();
					case "from":
						return importFromStatement();
					default:
						break;
				}
			}
			return expressionStatement();
		}

		private PyNode deleteStatement() {
			PyNode node = node("Delete", next());
			do {
				if (atStatementEnd()) {
					break;
				}
				PyNode target = expr();
				setContext(target, "Del");
				node.add(target);
			} while (acceptOp(","));
			return node;
		}

		private PyNode importStatement() {
			PyNode node = node("Import", next());
			do {
				node.add(dottedAlias());
			} while (acceptOp(","));
			return node;
		}

		private PyNode dottedAlias() {
			TokenInfo first = expectName();
			StringBuilder name = new StringBuilder(first.getString());
			while (acceptOp(".")) {
				name.append('.').append(expectName().getString());
			}
			if (acceptKeyword("as")) {
				name.append(" as ").append(expectName().getString());
			}
			return leaf("alias", name.toString(), first);
		}

		private PyNode importFromStatement() {
			PyNode node = node("ImportFrom", next());
			boolean relative = false;
			while (checkOp(".") || checkOp("...")) {
				next();
				relative = true;
			}
			if (!checkKeyword("import")) {
				expectName();
				while (acceptOp(".")) {
					expectName();
				}
			} else if (!relative) {
				throw error("expected a module name", peek());
			}
			expectKeyword("import");
			if (checkOp("*")) {
				node.add(leaf("alias", "*", next()));
				return node;
			}
			boolean parenthesized = acceptOp("(");
			do {
				if (parenthesized && checkOp(")")) {
					break;
				}
				TokenInfo name = expectName();
				String value = name.getString();
				if (acceptKeyword("as")) {
					value += " as " + expectName().getString();
				}
				node.add(leaf("alias", value, name));
			} while (acceptOp(","));
			if (parenthesized) {
				expectOp(")");
			}
			return node;
		}

		private PyNode expressionStatement() {
			PyNode first = testListStarExpr();
			TokenInfo start = start(first);
			if (checkOp("=")) {
				PyNode node = node("Assign", start);
				List<PyNode> parts = new ArrayList<>();
				parts.add(first);
				while (acceptOp("=")) {
					parts.add(checkKeyword("yield") ? yieldExpr() : testListStarExpr());
				}
				for (int i = 0; i < parts.size() - 1; i++) {
					setContext(parts.get(i), "Store");
				}
				return node.addAll(parts);
			}
			if (checkOp(":")) {
				next();
				PyNode node = node("AnnAssign", start);
				setContext(first, "Store");
				node.add(first).add(test());
				if (acceptOp("=")) {
					node.add(checkKeyword("yield") ? yieldExpr() : testListStarExpr());
				}
				return node;
			}
			if (peek().getType() == TokenType.OP && AUGMENTED_ASSIGNMENTS.contains(peek().getString())) {
				String operator = next().getString();
				PyNode node = node("AugAssign", start);
				setContext(first, "Store");
				node.add(first).add(PyNode.marker(operatorName(operator.substring(0, operator.length() - 1))));
				node.add(checkKeyword("yield") ? yieldExpr() : testListStarExpr());
				return node;
			}
			return node("Expr", start).add(first);
		}

		private PyNode asyncStatement() {
			TokenInfo async = next();
			if (checkKeyword("def")) {
				return functionDef(new ArrayList<>(), async);
			}
			if (checkKeyword("for")) {
				return forStatement(async);
			}
			if (checkKeyword("with")) {
				return withStatement(async);
			}
			throw error("expected 'def', 'for' or 'with' after 'async'", peek());
		}

		private PyNode decorated() {
			List<PyNode> decorators = new ArrayList<>();
			while (acceptOp("@")) {
				decorators.add(namedExprTest());
				expect(TokenType.NEWLINE);
			}
			if (checkKeyword("class")) {
				return classDef(decorators);
			}
			if (checkKeyword("async")) {
				TokenInfo async = next();
				return functionDef(decorators, async);
			}
			return functionDef(decorators, null);
		}

		private PyNode functionDef(List<PyNode> decorators, TokenInfo async) {
			TokenInfo def = expectKeyword("def");
			PyNode node = async != null ? node("AsyncFunctionDef", async) : node("FunctionDef", def);
			node.addAll(decorators);
			expectName();
			expectOp("(");
			node.add(arguments(")", true));
			expectOp(")");
			if (acceptOp("->")) {
				node.add(test());
			}
			expectOp(":");
			return node.addAll(suite());
		}

		private PyNode classDef(List<PyNode> decorators) {
			PyNode node = node("ClassDef", expectKeyword("class"));
			node.addAll(decorators);
			expectName();
			if (acceptOp("(")) {
				node.addAll(callArguments(null));
				expectOp(")");
			}
			expectOp(":");
			return node.addAll(suite());
		}

		/**
		 * Parses a parameter list up to (not including) the closing token. All
		 * parameters and defaults become children in source order.
		 */
		private PyNode arguments(String closer, boolean annotations) {
			PyNode arguments = PyNode.unpositioned("arguments");
			while (!checkOp(closer)) {
				if (acceptOp("/")) {
					// positional-only marker
				} else if (acceptOp("**")) {
					arguments.add(parameter(annotations));
				} else if (acceptOp("*")) {
					if (!checkOp(",") && !checkOp(closer)) {
						arguments.add(parameter(annotations));
					}
				} else {
					arguments.add(parameter(annotations));
					if (acceptOp("=")) {
						arguments.add(test());
					}
				}
				if (!acceptOp(",")) {
					break;
				}
			}
			return arguments;
		}

		private PyNode parameter(boolean annotations) {
			TokenInfo name = expectName();
			PyNode arg = leaf("arg", name.getString(), name);
			if (annotations && acceptOp(":")) {
				arg.add(test());
			}
			return arg;
		}

		private List<PyNode> suite() {
			if (!check(TokenType.NEWLINE)) {
				return simpleStatements();
			}
			next();
			expect(TokenType.INDENT);
			List<PyNode> body = new ArrayList<>();
			while (!check(TokenType.DEDENT) && !check(TokenType.ENDMARKER)) {
				if (check(TokenType.NEWLINE)) {
					next();
					continue;
				}
				body.addAll(statement());
			}
			if (check(TokenType.DEDENT)) {
				next();
			}
			return body;
		}

		private PyNode ifStatement() {
			List<PyNode> chain = new ArrayList<>();
			PyNode first = node("If", expectKeyword("if"));
			first.add(namedExprTest());
			expectOp(":");
			first.addAll(suite());
			chain.add(first);
			while (checkKeyword("elif")) {
				PyNode elif = node("If", next());
				elif.add(namedExprTest());
				expectOp(":");
				elif.addAll(suite());
				chain.add(elif);
			}
			List<PyNode> orElse = new ArrayList<>();
			if (acceptKeyword("else")) {
				expectOp(":");
				orElse = suite();
			}
			chain.get(chain.size() - 1).addAll(orElse);
			for (int i = chain.size() - 1; i > 0; i--) {
				chain.get(i - 1).add(chain.get(i));
			}
			return first;
		}

		private PyNode whileStatement() {
			PyNode node = node("While", expectKeyword("while"));
			node.add(namedExprTest());
			expectOp(":");
			node.addAll(suite());
			if (acceptKeyword("else")) {
				expectOp(":");
				node.addAll(suite());
			}
			return node;
		}

		private PyNode forStatement(TokenInfo async) {
			TokenInfo keyword = expectKeyword("for");
			PyNode node = async != null ? node("AsyncFor", async) : node("For", keyword);
			PyNode target = targetList();
			setContext(target, "Store");
			expectKeyword("in");
			node.add(target).add(testListStarExpr());
			expectOp(":");
			node.addAll(suite());
			if (acceptKeyword("else")) {
				expectOp(":");
				node.addAll(suite());
			}
			return node;
		}

		private PyNode tryStatement() {
			PyNode node = node("Try", expectKeyword("try"));
			expectOp(":");
			node.addAll(suite());
			boolean handled = false;
			while (checkKeyword("except")) {
				PyNode handler = node("ExceptHandler", next());
				if (!checkOp(":")) {
					handler.add(test());
					if (acceptKeyword("as")) {
						expectName();
					}
				}
				expectOp(":");
				node.add(handler.addAll(suite()));
				handled = true;
			}
			if (handled && acceptKeyword("else")) {
				expectOp(":");
				node.addAll(suite());
			}
			if (acceptKeyword("finally")) {
				expectOp(":");
				node.addAll(suite());
			} else if (!handled) {
				throw error("expected 'except' or 'finally'", peek());
			}
			return node;
		}

		private PyNode withStatement(TokenInfo async) {
			TokenInfo keyword = expectKeyword("with");
			PyNode node = async != null ? node("AsyncWith", async) : node("With", keyword);
			do {
				PyNode item = PyNode.unpositioned("withitem");
				item.add(test());
				if (acceptKeyword("as")) {
					PyNode target = expr();
					setContext(target, "Store");
					item.add(target);
				}
				node.add(item);
			} while (acceptOp(","));
			expectOp(":");
			return node.addAll(suite());
		}

		// ---- expressions --------------------------------------------------

		private boolean startsExpression(TokenInfo token) {
			switch (token.getType()) {
				case NUMBER:
				case STRING:
					return true;
				case NAME:
					return !KEYWORDS.contains(token.getString()) || Set.of("True", "False", "None", "not", "lambda",
							"await", "yield").contains(token.getString());
				case OP:
					return Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.getString());
				default:
					return false;
			}
		}

		private PyNode testListStarExpr() {
			if (checkKeyword("yield")) {
				return yieldExpr();
			}
			PyNode first = checkOp("*") ? starExpr() : namedExprTest();
			if (!checkOp(",")) {
				return first;
			}
			PyNode tuple = node("Tuple", start(first)).add(first);
			while (acceptOp(",")) {
				if (!startsExpression(peek())) {
					break;
				}
				tuple.add(checkOp("*") ? starExpr() : namedExprTest());
			}
			return tuple.add(PyNode.marker("Load"));
		}

		/** Targets of {@code for} loops and comprehensions. */
		private PyNode targetList() {
			PyNode first = checkOp("*") ? starExpr() : expr();
			if (!checkOp(",")) {
				return first;
			}
			PyNode tuple = node("Tuple", start(first)).add(first);
			while (acceptOp(",")) {
				if (checkKeyword("in") || !startsExpression(peek())) {
					break;
				}
				tuple.add(checkOp("*") ? starExpr() : expr());
			}
			return tuple.add(PyNode.marker("Load"));
		}

		private PyNode yieldExpr() {
			TokenInfo keyword = expectKeyword("yield");
			if (acceptKeyword("from")) {
				return node("YieldFrom", keyword).add(test());
			}
			PyNode node = node("Yield", keyword);
			if (startsExpression(peek())) {
				node.add(testListStarExpr());
			}
			return node;
		}

		private PyNode starExpr() {
			PyNode node = node("Starred", expectOp("*"));
			return node.add(expr()).add(PyNode.marker("Load"));
		}

		private PyNode namedExprTest() {
			PyNode target = test();
			if (!checkOp(":=")) {
				return target;
			}
			next();
			setContext(target, "Store");
			return node("NamedExpr", start(target)).add(target).add(test());
		}

		private PyNode test() {
			if (checkKeyword("lambda")) {
				return lambda();
			}
			PyNode body = orTest();
			if (!checkKeyword("if")) {
				return body;
			}
			next();
			PyNode condition = orTest();
			expectKeyword("else");
			return node("IfExp", start(body)).add(body).add(condition).add(test());
		}

		private PyNode lambda() {
			PyNode node = node("Lambda", expectKeyword("lambda"));
			node.add(arguments(":", false));
			expectOp(":");
			return node.add(test());
		}

		private PyNode orTest() {
			return boolOp("or", "Or");
		}

		private PyNode boolOp(String keyword, String operator) {
			PyNode first = "or".equals(keyword) ? boolOp("and", "And") : notTest();
			if (!checkKeyword(keyword)) {
				return first;
			}
			PyNode node = node("BoolOp", start(first)).add(PyNode.marker(operator)).add(first);
			while (acceptKeyword(keyword)) {
				node.add("or".equals(keyword) ? boolOp("and", "And") : notTest());
			}
			return node;
		}

		private PyNode notTest() {
			if (checkKeyword("not")) {
				PyNode node = node("UnaryOp", next()).add(PyNode.marker("Not"));
				return node.add(notTest());
			}
			return comparison();
		}

		private PyNode comparison() {
			PyNode left = expr();
			PyNode node = null;
			while (true) {
				String operator = comparisonOperator();
				if (operator == null) {
					break;
				}
				if (node == null) {
					node = node("Compare", start(left)).add(left);
				}
				node.add(PyNode.marker(operator)).add(expr());
			}
			return node != null ? node : left;
		}

		private String comparisonOperator() {
			TokenInfo token = peek();
			if (token.getType() == TokenType.OP && COMPARISONS.contains(token.getString())) {
				next();
				return comparisonName(token.getString());
			}
			if (isKeyword(token, "in")) {
				next();
				return "In";
			}
			if (isKeyword(token, "not") && isKeyword(peek(1), "in")) {
				next();
				next();
				return "NotIn";
			}
			if (isKeyword(token, "is")) {
				next();
				return acceptKeyword("not") ? "IsNot" : "Is";
			}
			return null;
		}

		private PyNode expr() {
			return binary(0);
		}

		private PyNode binary(int level) {
			PyNode left = level == BINARY_OPERATORS.length - 1 ? factor() : binary(level + 1);
			while (peek().getType() == TokenType.OP && matchesAny(peek().getString(), BINARY_OPERATORS[level])) {
				String operator = next().getString();
				PyNode right = level == BINARY_OPERATORS.length - 1 ? factor() : binary(level + 1);
				left = node("BinOp", start(left)).add(left).add(PyNode.marker(operatorName(operator))).add(right);
			}
			return left;
		}

		private static boolean matchesAny(String value, String[] candidates) {
			for (String candidate : candidates) {
				if (candidate.equals(value)) {
					return true;
				}
			}
			return false;
		}

		private PyNode factor() {
			TokenInfo token = peek();
			if (isOp(token, "-") || isOp(token, "+") || isOp(token, "~")) {
				next();
				String operator = isOp(token, "-") ? "USub" : isOp(token, "+") ? "UAdd" : "Invert";
				return node("UnaryOp", token).add(PyNode.marker(operator)).add(factor());
			}
			return power();
		}

		private PyNode power() {
			PyNode base = atomExpr();
			if (!acceptOp("**")) {
				return base;
			}
			return node("BinOp", start(base)).add(base).add(PyNode.marker("Pow")).add(factor());
		}

		private PyNode atomExpr() {
			if (checkKeyword("await")) {
				TokenInfo await = next();
				return node("Await", await).add(atomExpr());
			}
			PyNode node = atom();
			while (true) {
				if (checkOp("(")) {
					TokenInfo open = next();
					PyNode call = node("Call", start(node)).add(node);
					call.addAll(callArguments(open));
					expectOp(")");
					node = call;
				} else if (acceptOp("[")) {
					PyNode subscript = node("Subscript", start(node)).add(node).add(subscriptList());
					expectOp("]");
					node = subscript.add(PyNode.marker("Load"));
				} else if (acceptOp(".")) {
					TokenInfo name = expectName();
					node = leaf("Attribute", name.getString(), start(node)).add(node).add(PyNode.marker("Load"));
				} else {
					return node;
				}
			}
		}

		/**
		 * Parses call arguments up to the closing parenthesis. A generator
		 * expression passed as the only argument starts at {@code open}; class
		 * definitions pass {@code null}.
		 */
		private List<PyNode> callArguments(TokenInfo open) {
			List<PyNode> arguments = new ArrayList<>();
			while (!checkOp(")")) {
				if (checkOp("*")) {
					arguments.add(starExpr());
				} else if (checkOp("**")) {
					arguments.add(node("keyword", next()).add(test()));
				} else if (peek().getType() == TokenType.NAME && isOp(peek(1), "=")) {
					TokenInfo name = next();
					next();
					arguments.add(leaf("keyword", name.getString(), name).add(test()));
				} else {
					PyNode argument = namedExprTest();
					if (open != null && startsComprehension()) {
						PyNode generator = node("GeneratorExp", open).add(argument);
						generator.addAll(comprehensions());
						argument = generator;
					}
					arguments.add(argument);
				}
				if (!acceptOp(",")) {
					break;
				}
			}
			return arguments;
		}

		private PyNode subscriptList() {
			PyNode first = subscript();
			if (!checkOp(",")) {
				return first;
			}
			PyNode tuple = node("Tuple", start(first)).add(first);
			while (acceptOp(",")) {
				if (checkOp("]")) {
					break;
				}
				tuple.add(subscript());
			}
			return tuple.add(PyNode.marker("Load"));
		}

		private PyNode subscript() {
			PyNode lower = null;
			if (!checkOp(":")) {
				lower = namedExprTest();
				if (!checkOp(":")) {
					return lower;
				}
			}
			TokenInfo colon = expectOp(":");
			PyNode slice = node("Slice", lower != null ? start(lower) : colon).add(lower);
			if (!checkOp("]") && !checkOp(",") && !checkOp(":")) {
				slice.add(test());
			}
			if (acceptOp(":") && !checkOp("]") && !checkOp(",")) {
				slice.add(test());
			}
			return slice;
		}

		private boolean startsComprehension() {
			return checkKeyword("for") || (checkKeyword("async") && isKeyword(peek(1), "for"));
		}

		private List<PyNode> comprehensions() {
			List<PyNode> result = new ArrayList<>();
			while (startsComprehension()) {
				PyNode comprehension = PyNode.unpositioned("comprehension");
				acceptKeyword("async");
				expectKeyword("for");
				PyNode target = targetList();
				setContext(target, "Store");
				expectKeyword("in");
				comprehension.add(target).add(orTest());
				while (acceptKeyword("if")) {
					comprehension.add(orTest());
				}
				result.add(comprehension);
			}
			return result;
		}

		private PyNode atom() {
			TokenInfo token = peek();
			switch (token.getType()) {
				case NUMBER:
					return leaf("Num", next().getString(), token);
				case STRING:
					return strings();
				case NAME:
					return name();
				case OP:
					break;
				default:
					throw error("expected an expression", token);
			}
			switch (token.getString()) {
				case "(":
					return parenthesized();
				case "[":
					return list();
				case "{":
					return dictOrSet();
				case "...":
					return node("Ellipsis", next());
				default:
					throw error("expected an expression", token);
			}
		}

		private PyNode name() {
			TokenInfo token = peek();
			String value = token.getString();
			if ("True".equals(value) || "False".equals(value) || "None".equals(value)) {
				return leaf("NameConstant", next().getString(), token);
			}
			return leaf("Name", expectName().getString(), token).add(PyNode.marker("Load"));
		}

		private PyNode strings() {
			TokenInfo first = peek();
			StringBuilder value = new StringBuilder();
			boolean formatted = false;
			boolean bytes = false;
			while (check(TokenType.STRING)) {
				String literal = next().getString();
				String prefix = stringPrefix(literal);
				formatted |= prefix.contains("f");
				bytes |= prefix.contains("b");
				if (value.length() > 0) {
					value.append(' ');
				}
				value.append(literal);
			}
			String kind = formatted ? "JoinedStr" : bytes ? "Bytes" : "Str";
			return leaf(kind, value.toString(), first);
		}

		private static String stringPrefix(String literal) {
			int quote = 0;
			while (quote < literal.length() && literal.charAt(quote) != '\'' && literal.charAt(quote) != '"') {
				quote++;
			}
			return literal.substring(0, quote).toLowerCase(Locale.ROOT);
		}

		private PyNode parenthesized() {
			TokenInfo open = expectOp("(");
			if (checkOp(")")) {
				next();
				return node("Tuple", open).add(PyNode.marker("Load"));
			}
			if (checkKeyword("yield")) {
				PyNode yield = yieldExpr();
				expectOp(")");
				starts.put(yield, open);
				return yield;
			}
			PyNode first = checkOp("*") ? starExpr() : namedExprTest();
			if (startsComprehension()) {
				PyNode generator = node("GeneratorExp", open).add(first).addAll(comprehensions());
				expectOp(")");
				return generator;
			}
			if (!checkOp(",")) {
				expectOp(")");
				starts.put(first, open);
				return first;
			}
			PyNode tuple = node("Tuple", open).add(first);
			while (acceptOp(",")) {
				if (checkOp(")")) {
					break;
				}
				tuple.add(checkOp("*") ? starExpr() : namedExprTest());
			}
			expectOp(")");
			return tuple.add(PyNode.marker("Load"));
		}

		private PyNode list() {
			TokenInfo open = expectOp("[");
			if (acceptOp("]")) {
				return node("List", open).add(PyNode.marker("Load"));
			}
			PyNode first = checkOp("*") ? starExpr() : namedExprTest();
			if (startsComprehension()) {
				PyNode comprehension = node("ListComp", open).add(first).addAll(comprehensions());
				expectOp("]");
				return comprehension;
			}
			PyNode list = node("List", open).add(first);
			while (acceptOp(",")) {
				if (checkOp("]")) {
					break;
				}
				list.add(checkOp("*") ? starExpr() : namedExprTest());
			}
			expectOp("]");
			return list.add(PyNode.marker("Load"));
		}

		private PyNode dictOrSet() {
			TokenInfo open = expectOp("{");
			if (acceptOp("}")) {
				return node("Dict", open);
			}
			if (checkOp("**")) {
				return dictItems(node("Dict", open));
			}
			PyNode first = checkOp("*") ? starExpr() : test();
			if (acceptOp(":")) {
				PyNode value = test();
				if (startsComprehension()) {
					PyNode comprehension = node("DictComp", open).add(first).add(value).addAll(comprehensions());
					expectOp("}");
					return comprehension;
				}
				PyNode dict = node("Dict", open).add(first).add(value);
				if (acceptOp(",")) {
					return dictItems(dict);
				}
				expectOp("}");
				return dict;
			}
			if (startsComprehension()) {
				PyNode comprehension = node("SetComp", open).add(first).addAll(comprehensions());
				expectOp("}");
				return comprehension;
			}
			PyNode set = node("Set", open).add(first);
			while (acceptOp(",")) {
				if (checkOp("}")) {
					break;
				}
				set.add(checkOp("*") ? starExpr() : test());
			}
			expectOp("}");
			return set;
		}

		/** Parses the remaining {@code key: value} and {@code **mapping} items of a dict display. */
		private PyNode dictItems(PyNode dict) {
			while (!checkOp("}")) {
				if (acceptOp("**")) {
					dict.add(expr());
				} else {
					dict.add(test());
					expectOp(":");
					dict.add(test());
				}
				if (!acceptOp(",")) {
					break;
				}
			}
			expectOp("}");
			return dict;
		}
	}
}
