package org.metricshub.jfloop.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jfloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.metricshub.jfloop.frontend.ParseTree.Symbol;
import org.metricshub.jfloop.util.FloopLogger;
import org.metricshub.jfloop.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts the text of a Floop program into a {@link ParseTree}.
 * <p>
 * It contains the internal state of the parser and the lexer, so an
 * instance must not be shared between threads. It does not check block
 * labels; that is the job of the {@link BlockValidator}.
 */
public class FloopParser {

	private static final Logger LOGGER = FloopLogger.getLogger(FloopParser.class);

	private static final Pattern PARAMETER_NAME = Pattern.compile("[A-Z]+");

	/** Lexer token values. */
	enum Token {
		EOF,
		INTEGER,
		NAME,
		QUOTED_NAME,

		OPEN_BRACKET,
		CLOSE_BRACKET,
		OPEN_PAREN,
		CLOSE_PAREN,
		COMMA,
		COLON,
		SEMICOLON,

		ASSIGN,
		PLUS,
		MULT,
		EQ,
		LT,
		GT,

		KW_DEFINE,
		KW_PROCEDURE,
		KW_BLOCK,
		KW_BEGIN,
		KW_END,
		KW_LOOP,
		KW_AT,
		KW_MOST,
		KW_TIMES,
		KW_MU_LOOP,
		KW_IF,
		KW_THEN,
		KW_QUIT,
		KW_ABORT,
		KW_CELL,
		KW_OUTPUT,
		KW_YES,
		KW_NO
	}

	/**
	 * Keywords of the language and their token values.
	 * <code>MU-LOOP</code> is not in this map since it is not a plain word.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("DEFINE", Token.KW_DEFINE);
		KEYWORDS.put("PROCEDURE", Token.KW_PROCEDURE);
		KEYWORDS.put("BLOCK", Token.KW_BLOCK);
		KEYWORDS.put("BEGIN", Token.KW_BEGIN);
		KEYWORDS.put("END", Token.KW_END);
		KEYWORDS.put("LOOP", Token.KW_LOOP);
		KEYWORDS.put("AT", Token.KW_AT);
		KEYWORDS.put("MOST", Token.KW_MOST);
		KEYWORDS.put("TIMES", Token.KW_TIMES);
		KEYWORDS.put("IF", Token.KW_IF);
		KEYWORDS.put("THEN", Token.KW_THEN);
		KEYWORDS.put("QUIT", Token.KW_QUIT);
		KEYWORDS.put("ABORT", Token.KW_ABORT);
		KEYWORDS.put("CELL", Token.KW_CELL);
		KEYWORDS.put("OUTPUT", Token.KW_OUTPUT);
		KEYWORDS.put("YES", Token.KW_YES);
		KEYWORDS.put("NO", Token.KW_NO);
	}

	/** Keywords that are values themselves, hence never parameter names. */
	private static final Set<Token> RESERVED_PARAMETER_NAMES = EnumSet.of(
			Token.KW_YES,
			Token.KW_NO,
			Token.KW_OUTPUT,
			Token.KW_CELL,
			Token.KW_MU_LOOP);

	/**
	 * What an operand may evaluate to, as far as the grammar can tell.
	 * Numbers and parameters are integers, <code>YES</code>/<code>NO</code>
	 * are booleans, cells, <code>OUTPUT</code> and calls may be either.
	 */
	private enum Category {
		INTEGER,
		BOOLEAN,
		EITHER;

		boolean canBeInteger() {
			return this != BOOLEAN;
		}

		boolean canBeBoolean() {
			return this != INTEGER;
		}
	}

	private String sourceDescription;
	private Reader reader;
	private int c;
	private int line;
	private int column;

	private Token token;
	private final StringBuilder text = new StringBuilder();
	private int tokenLine;
	private int tokenColumn;

	/** Parameters of the declaration being parsed; {@code null} at top level. */
	private Set<String> currentParameters;

	/**
	 * Parse the program streamed by the script source.
	 *
	 * @param source the program text
	 * @return the parse tree of the whole program
	 * @throws IOException upon an IO error
	 * @throws LexerException if the text contains an invalid token
	 * @throws ParserException if the text does not follow the grammar
	 */
	public ParseTree parse(ScriptSource source) throws IOException {
		if (source == null) {
			throw new IOException("No source supplied");
		}
		this.sourceDescription = source.getDescription();
		this.reader = source.getReader();
		if (reader == null) {
			throw new IOException("Source " + sourceDescription + " has no content");
		}
		line = 1;
		column = 0;
		c = '\n';
		currentParameters = null;
		read();
		// read() counted the initial placeholder as a line break
		line = 1;
		column = 1;
		lexer();
		ParseTree program = PROGRAM();
		LOGGER.debug("Parsed {} ({} declaration(s))", sourceDescription, program.getChildCount());
		return program;
	}

	/**
	 * Parse a program given as a string.
	 *
	 * @param script the program text
	 * @return the parse tree of the whole program
	 * @throws IOException never in practice, the text is in memory
	 */
	public ParseTree parse(String script) throws IOException {
		return parse(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)));
	}

	private void read() throws IOException {
		if (c == '\n' || c == '\r') {
			line++;
			column = 1;
		} else if (c >= 0) {
			column++;
		}
		int previous = c;
		c = reader.read();
		// \r\n is a single line break
		if (previous == '\r' && c == '\n') {
			c = reader.read();
		}
	}

	private LexerException lexerException(String msg) {
		return new LexerException(msg, sourceDescription, tokenLine, tokenColumn);
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, sourceDescription, tokenLine, tokenColumn);
	}

	private static boolean isWordChar(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '_';
	}

	private Token lexer(Token expectedToken) throws IOException {
		if (token != expectedToken) {
			throw parserException("Expecting " + describe(expectedToken) + ". Found: " + describe(token) + " (" + text + ")");
		}
		return lexer();
	}

	private Token lexer() throws IOException {
		// clear whitespace
		while (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
			read();
		}
		text.setLength(0);
		tokenLine = line;
		tokenColumn = column;
		if (c < 0) {
			token = Token.EOF;
			return token;
		}
		switch (c) {
		case '[':
			return single(Token.OPEN_BRACKET);
		case ']':
			return single(Token.CLOSE_BRACKET);
		case '(':
			return single(Token.OPEN_PAREN);
		case ')':
			return single(Token.CLOSE_PAREN);
		case ',':
			return single(Token.COMMA);
		case ':':
			return single(Token.COLON);
		case ';':
			return single(Token.SEMICOLON);
		case '+':
			return single(Token.PLUS);
		case '*':
			return single(Token.MULT);
		case '=':
			return single(Token.EQ);
		case '>':
			return single(Token.GT);
		case '<':
			text.append((char) c);
			read();
			if (c == '=') {
				return single(Token.ASSIGN);
			}
			token = Token.LT;
			return token;
		case '"':
			read();
			while (isWordChar(c)) {
				text.append((char) c);
				read();
			}
			if (c == '?') {
				text.append((char) c);
				read();
			}
			if (c != '"') {
				throw lexerException("Unterminated procedure name: \"" + text);
			}
			read();
			if (text.length() == 0) {
				throw lexerException("Empty procedure name");
			}
			token = Token.QUOTED_NAME;
			return token;
		default:
			break;
		}
		if (!isWordChar(c)) {
			text.append((char) c);
			throw lexerException("Unexpected character '" + text + "'");
		}
		while (isWordChar(c)) {
			text.append((char) c);
			read();
		}
		String word = text.toString();
		if (isAllDigits(word)) {
			if (word.length() > 1 && word.charAt(0) == '0') {
				throw lexerException("Numbers cannot have leading zeros: " + word);
			}
			token = Token.INTEGER;
			return token;
		}
		if (word.equals("MU") && c == '-') {
			text.append((char) c);
			read();
			while (isWordChar(c)) {
				text.append((char) c);
				read();
			}
			if (!text.toString().equals("MU-LOOP")) {
				throw lexerException("Unexpected word " + text);
			}
			token = Token.KW_MU_LOOP;
			return token;
		}
		Token keyword = KEYWORDS.get(word);
		if (keyword != null) {
			token = keyword;
			return token;
		}
		if (c == '?') {
			text.append((char) c);
			read();
		}
		token = Token.NAME;
		return token;
	}

	private Token single(Token t) throws IOException {
		text.append((char) c);
		read();
		token = t;
		return token;
	}

	private static boolean isAllDigits(String word) {
		for (int i = 0; i < word.length(); i++) {
			char ch = word.charAt(i);
			if (ch < '0' || ch > '9') {
				return false;
			}
		}
		return true;
	}

	/**
	 * Words that may name a parameter: plain names and the keywords that
	 * never stand for a value.
	 */
	private static boolean isParameterToken(Token t) {
		return t == Token.NAME || (t.name().startsWith("KW_") && !RESERVED_PARAMETER_NAMES.contains(t));
	}

	/** Whether the current token is a keyword used as a parameter of the current declaration. */
	private boolean isKeywordParameter() {
		return token != Token.NAME
				&& isParameterToken(token)
				&& currentParameters != null
				&& currentParameters.contains(text.toString());
	}

	private static String describe(Token t) {
		switch (t) {
		case KW_MU_LOOP:
			return "MU-LOOP";
		case ASSIGN:
			return "<=";
		default:
			return t.name().startsWith("KW_") ? t.name().substring(3) : t.name();
		}
	}

	/** Consume the current token as a leaf of the given symbol. */
	private ParseTree leaf(Symbol symbol) throws IOException {
		ParseTree leaf = ParseTree.leaf(symbol, text.toString(), tokenLine, tokenColumn);
		lexer();
		return leaf;
	}

	// PROGRAM = DECLARATION* [CALL] EOF
	ParseTree PROGRAM() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		List<ParseTree> children = new ArrayList<ParseTree>();
		while (token == Token.KW_DEFINE) {
			children.add(DECLARATION());
		}
		if (token == Token.NAME) {
			currentParameters = null;
			String name = text.toString();
			int nameLine = tokenLine;
			int nameColumn = tokenColumn;
			lexer();
			if (token != Token.OPEN_PAREN) {
				throw parserException("Expecting a call to " + name + ". Found: " + describe(token) + " (" + text + ")");
			}
			children.add(CALL(name, nameLine, nameColumn));
		}
		if (token != Token.EOF) {
			throw parserException("Expecting DEFINE, a procedure call or the end of the program. Found: " + describe(token) + " (" + text + ")");
		}
		return ParseTree.node(Symbol.PROGRAM, l, col, children);
	}

	// DECLARATION = DEFINE PROCEDURE "name" PARAMETERS : BLOCK
	ParseTree DECLARATION() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.KW_DEFINE);
		if (token != Token.KW_PROCEDURE) {
			throw parserException("Expecting PROCEDURE. Found: " + describe(token) + " (" + text + ")");
		}
		lexer();
		if (token != Token.QUOTED_NAME) {
			throw parserException("Expecting a quoted procedure name. Found: " + describe(token) + " (" + text + ")");
		}
		ParseTree name = leaf(Symbol.NAME);
		ParseTree parameters = PARAMETERS();
		lexer(Token.COLON);
		ParseTree body = BLOCK();
		currentParameters = null;
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(name);
		children.add(parameters);
		children.add(body);
		return ParseTree.node(Symbol.DECLARATION, l, col, children);
	}

	// PARAMETERS = [ PARAMETER ( , PARAMETER )* ]
	ParseTree PARAMETERS() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.OPEN_BRACKET);
		Set<String> names = new LinkedHashSet<String>();
		List<ParseTree> children = new ArrayList<ParseTree>();
		while (true) {
			if (RESERVED_PARAMETER_NAMES.contains(token)) {
				throw parserException("Reserved word " + text + " cannot be a parameter name");
			}
			if (!isParameterToken(token) || !PARAMETER_NAME.matcher(text).matches()) {
				throw parserException("Expecting a parameter name in capital letters. Found: " + describe(token) + " (" + text + ")");
			}
			if (!names.add(text.toString())) {
				throw parserException("Duplicate parameter " + text);
			}
			children.add(leaf(Symbol.PARAMETER));
			if (token != Token.COMMA) {
				break;
			}
			lexer();
		}
		lexer(Token.CLOSE_BRACKET);
		currentParameters = names;
		return ParseTree.node(Symbol.PARAMETERS, l, col, children);
	}

	// BLOCK = BLOCK n : BEGIN STATEMENT* BLOCK n : END
	ParseTree BLOCK() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		List<ParseTree> children = new ArrayList<ParseTree>();
		lexer(Token.KW_BLOCK);
		children.add(LABEL());
		lexer(Token.COLON);
		lexer(Token.KW_BEGIN);
		while (token != Token.KW_BLOCK) {
			children.add(STATEMENT());
		}
		lexer(Token.KW_BLOCK);
		children.add(LABEL());
		lexer(Token.COLON);
		lexer(Token.KW_END);
		return ParseTree.node(Symbol.BLOCK, l, col, children);
	}

	private ParseTree LABEL() throws IOException {
		if (token != Token.INTEGER) {
			throw parserException("Expecting a block number. Found: " + describe(token) + " (" + text + ")");
		}
		checkIntRange("Block number");
		return leaf(Symbol.LABEL);
	}

	private void checkIntRange(String what) {
		if (text.length() > 10 || Long.parseLong(text.toString()) > Integer.MAX_VALUE) {
			throw parserException(what + " too large: " + text);
		}
	}

	// STATEMENT = LOOP | MU_LOOP | CONDITIONAL | QUIT | ABORT | ASSIGNMENT
	ParseTree STATEMENT() throws IOException {
		switch (token) {
		case KW_LOOP:
			return LOOP();
		case KW_MU_LOOP:
			return MU_LOOP();
		case KW_IF:
			return CONDITIONAL();
		case KW_QUIT:
			return EXIT(Token.KW_QUIT, Token.KW_BLOCK, Symbol.QUIT);
		case KW_ABORT:
			return EXIT(Token.KW_ABORT, Token.KW_LOOP, Symbol.ABORT);
		case KW_CELL:
		case KW_OUTPUT:
			return ASSIGNMENT();
		case EOF:
			throw parserException("Unexpected end of program inside a block");
		default:
			throw parserException("Expecting a statement. Found: " + describe(token) + " (" + text + ")");
		}
	}

	// LOOP = LOOP [AT MOST] intval TIMES : BLOCK
	ParseTree LOOP() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.KW_LOOP);
		Symbol symbol = Symbol.LOOP;
		List<ParseTree> children = new ArrayList<ParseTree>();
		if (token == Token.KW_AT) {
			// AT is either the start of AT MOST or a parameter named AT
			boolean atIsParameter = isKeywordParameter();
			ParseTree at = ParseTree.leaf(Symbol.PARAMETER, text.toString(), tokenLine, tokenColumn);
			lexer();
			if (token == Token.KW_MOST || !atIsParameter) {
				lexer(Token.KW_MOST);
				symbol = Symbol.LOOP_AT_MOST;
				children.add(INT_VALUE());
			} else {
				children.add(at);
			}
		} else {
			children.add(INT_VALUE());
		}
		lexer(Token.KW_TIMES);
		lexer(Token.COLON);
		children.add(BLOCK());
		return ParseTree.node(symbol, l, col, children);
	}

	// MU_LOOP = MU-LOOP : BLOCK
	ParseTree MU_LOOP() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.KW_MU_LOOP);
		lexer(Token.COLON);
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(BLOCK());
		return ParseTree.node(Symbol.MU_LOOP, l, col, children);
	}

	// CONDITIONAL = IF boolexpr , THEN : BLOCK
	ParseTree CONDITIONAL() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.KW_IF);
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(BOOLEAN_EXPRESSION());
		lexer(Token.COMMA);
		lexer(Token.KW_THEN);
		lexer(Token.COLON);
		children.add(BLOCK());
		return ParseTree.node(Symbol.CONDITIONAL, l, col, children);
	}

	// QUIT = QUIT BLOCK n ;
	// ABORT = ABORT LOOP n ;
	private ParseTree EXIT(Token keyword, Token target, Symbol symbol) throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(keyword);
		lexer(target);
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(LABEL());
		lexer(Token.SEMICOLON);
		return ParseTree.node(symbol, l, col, children);
	}

	// ASSIGNMENT = (CELL(n) | OUTPUT) <= EXPRESSION ;
	ParseTree ASSIGNMENT() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		List<ParseTree> children = new ArrayList<ParseTree>();
		if (token == Token.KW_CELL) {
			children.add(CELL());
		} else {
			children.add(leaf(Symbol.OUTPUT));
		}
		lexer(Token.ASSIGN);
		children.add(EXPRESSION());
		lexer(Token.SEMICOLON);
		return ParseTree.node(Symbol.ASSIGNMENT, l, col, children);
	}

	// CELL = CELL ( n )
	private ParseTree CELL() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		lexer(Token.KW_CELL);
		lexer(Token.OPEN_PAREN);
		if (token != Token.INTEGER) {
			throw parserException("Expecting a cell number. Found: " + describe(token) + " (" + text + ")");
		}
		checkIntRange("Cell number");
		ParseTree cell = ParseTree.leaf(Symbol.CELL, text.toString(), l, col);
		lexer();
		lexer(Token.CLOSE_PAREN);
		return cell;
	}

	// EXPRESSION = operand [ (+ | * | = | < | >) operand ]
	ParseTree EXPRESSION() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		ParseTree left = OPERAND();
		if (!isOperator(token)) {
			return left;
		}
		return BINARY(left, l, col);
	}

	// boolexpr = boolval | operand (= | < | >) operand
	ParseTree BOOLEAN_EXPRESSION() throws IOException {
		int l = tokenLine;
		int col = tokenColumn;
		ParseTree left = OPERAND();
		if (token == Token.PLUS || token == Token.MULT) {
			throw parserException("Expecting a comparison. Found: " + describe(token) + " (" + text + ")");
		}
		if (isOperator(token)) {
			return BINARY(left, l, col);
		}
		if (!category(left).canBeBoolean()) {
			throw new ParserException("Expecting a boolean value. Found: " + left, sourceDescription, left.getLine(), left.getColumn());
		}
		return left;
	}

	private static boolean isOperator(Token t) {
		return t == Token.PLUS || t == Token.MULT || t == Token.EQ || t == Token.LT || t == Token.GT;
	}

	private ParseTree BINARY(ParseTree left, int l, int col) throws IOException {
		Token op = token;
		ParseTree operator = leaf(Symbol.OPERATOR);
		ParseTree right = OPERAND();
		Category lc = category(left);
		Category rc = category(right);
		boolean valid;
		if (op == Token.EQ) {
			valid = (lc.canBeInteger() && rc.canBeInteger()) || (lc.canBeBoolean() && rc.canBeBoolean());
		} else {
			valid = lc.canBeInteger() && rc.canBeInteger();
		}
		if (!valid) {
			throw new ParserException(
					"Operator " + operator.getText() + " cannot combine " + left + " and " + right,
					sourceDescription,
					operator.getLine(),
					operator.getColumn());
		}
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(left);
		children.add(operator);
		children.add(right);
		return ParseTree.node(Symbol.BINARY, l, col, children);
	}

	private ParseTree INT_VALUE() throws IOException {
		ParseTree operand = OPERAND();
		if (!category(operand).canBeInteger()) {
			throw new ParserException("Expecting a number. Found: " + operand, sourceDescription, operand.getLine(), operand.getColumn());
		}
		return operand;
	}

	// operand = n | YES | NO | CELL(n) | OUTPUT | PARAMETER | CALL
	ParseTree OPERAND() throws IOException {
		switch (token) {
		case INTEGER:
			return leaf(Symbol.NUMBER);
		case KW_YES:
		case KW_NO:
			return leaf(Symbol.BOOLEAN);
		case KW_CELL:
			return CELL();
		case KW_OUTPUT:
			return leaf(Symbol.OUTPUT);
		case NAME: {
			String name = text.toString();
			int l = tokenLine;
			int col = tokenColumn;
			lexer();
			if (token == Token.OPEN_PAREN) {
				return CALL(name, l, col);
			}
			if (currentParameters == null || !currentParameters.contains(name)) {
				throw new ParserException("Unknown parameter " + name, sourceDescription, l, col);
			}
			return ParseTree.leaf(Symbol.PARAMETER, name, l, col);
		}
		default:
			if (isKeywordParameter()) {
				return leaf(Symbol.PARAMETER);
			}
			throw parserException("Expecting a value. Found: " + describe(token) + " (" + text + ")");
		}
	}

	// CALL = name ( intval ( , intval )* )
	private ParseTree CALL(String name, int l, int col) throws IOException {
		List<ParseTree> children = new ArrayList<ParseTree>();
		children.add(ParseTree.leaf(Symbol.NAME, name, l, col));
		lexer(Token.OPEN_PAREN);
		children.add(INT_VALUE());
		while (token == Token.COMMA) {
			lexer();
			children.add(INT_VALUE());
		}
		lexer(Token.CLOSE_PAREN);
		return ParseTree.node(Symbol.CALL, l, col, children);
	}

	private static Category category(ParseTree operand) {
		switch (operand.getSymbol()) {
		case NUMBER:
		case PARAMETER:
			return Category.INTEGER;
		case BOOLEAN:
			return Category.BOOLEAN;
		case BINARY: {
			String op = operand.getChild(1).getText();
			return "+".equals(op) || "*".equals(op) ? Category.INTEGER : Category.BOOLEAN;
		}
		default:
			return Category.EITHER;
		}
	}
}
