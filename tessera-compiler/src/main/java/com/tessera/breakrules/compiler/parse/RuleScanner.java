/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.tessera.breakrules.api.exceptions.RuleSyntaxException;
import com.tessera.breakrules.api.model.ParseErrorLocation;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.sets.CodePointSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Recursive-descent scanner for break rule source.
 *
 * <h2>Statements</h2>
 * <pre>
 * !!chain;                       option
 * $Letter = [\p{L}];             variable definition
 * $Letter+ {200};                rule with status tag
 * !$Letter $Letter;              rule for the safe reverse tree
 * ^$Letter / $Digit;             no chain-in, look-ahead
 * </pre>
 *
 * <p>Every literal character, set expression and {@code .} becomes a
 * {@link SetLeaf}; identical source text shares one leaf. A scanner parses once.
 */
public final class RuleScanner {

    private static final Logger logger = Logger.getLogger(RuleScanner.class.getName());

    static final String ANY_SET_TEXT = "any";

    private final String rules;
    private final int[] text;
    int pos;

    private final NodeArena arena = new NodeArena();
    private final List<SetLeaf> setLeaves = new ArrayList<>();
    private final Map<String, SetLeaf> setLeavesByText = new HashMap<>();
    private final Map<String, Integer> variables = new HashMap<>();
    private final IntArrayList statusValues = new IntArrayList();
    private final Map<RuleTree, Integer> roots = new EnumMap<>(RuleTree.class);
    private final SetParser setParser;

    private RuleTree defaultTree = RuleTree.FORWARD;
    private boolean chainRules;
    private boolean lbcmNoChain;
    private boolean lookAheadHardBreak;
    private boolean quotedLiteralsOnly;

    private int ruleCount;
    private int currentRule;
    private boolean inDefinition;
    private boolean lookAheadSeen;
    private boolean parsed;

    public RuleScanner(String rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.text = rules.codePoints().toArray();
        this.setParser = new SetParser(this);
        statusValues.add(0);
    }

    /**
     * Parses the whole rule source.
     *
     * @return parse trees, set leaves, status values and options
     * @throws RuleSyntaxException on the first syntax error
     * @throws IllegalStateException if called twice
     */
    public ParsedRules parse() {
        if (parsed) {
            throw new IllegalStateException("Rules already parsed");
        }
        parsed = true;

        skipIgnorable();
        while (!atEnd()) {
            parseStatement();
            skipIgnorable();
        }

        if (!roots.containsKey(RuleTree.FORWARD)) {
            throw syntaxError(RuleErrorCode.RULE_SYNTAX, "No forward rules", text.length);
        }
        if (!roots.containsKey(RuleTree.REVERSE)) {
            int any = arena.add(RuleNode.setRef(leafFor(ANY_SET_TEXT, CodePointSet.all(), false, false).index()));
            roots.put(RuleTree.REVERSE, arena.add(RuleNode.unary(NodeType.STAR, any)));
        }

        logger.fine(() -> String.format("Parsed %d rules, %d variables, %d set leaves, %d status values",
                ruleCount, variables.size(), setLeaves.size(), statusValues.size()));

        return new ParsedRules(arena, roots, defaultTree, setLeaves, statusValues,
                new RuleOptions(chainRules, lbcmNoChain, lookAheadHardBreak, quotedLiteralsOnly),
                ruleCount, variables.size());
    }

    /**
     * Removes {@code #} comments outside quotes and sets, then drops the white
     * space that follows each {@code ;}.
     */
    public static String stripRules(String rules) {
        StringBuilder withoutComments = new StringBuilder(rules.length());
        boolean inQuote = false;
        int setDepth = 0;
        int i = 0;
        while (i < rules.length()) {
            int c = rules.codePointAt(i);
            int width = Character.charCount(c);
            if (c == '\\' && i + width < rules.length()) {
                int escaped = rules.codePointAt(i + width);
                withoutComments.appendCodePoint(c).appendCodePoint(escaped);
                i += width + Character.charCount(escaped);
                continue;
            }
            if (!inQuote && setDepth == 0 && c == '#') {
                while (i < rules.length() && !isNewline(rules.codePointAt(i))) {
                    i += Character.charCount(rules.codePointAt(i));
                }
                continue;
            }
            if (c == '\'' && setDepth == 0) {
                inQuote = !inQuote;
            } else if (!inQuote && c == '[') {
                setDepth++;
            } else if (!inQuote && c == ']' && setDepth > 0) {
                setDepth--;
            }
            withoutComments.appendCodePoint(c);
            i += width;
        }

        StringBuilder stripped = new StringBuilder(withoutComments.length());
        boolean skippingSpaces = false;
        for (int j = 0; j < withoutComments.length(); ) {
            int c = withoutComments.codePointAt(j);
            j += Character.charCount(c);
            if (skippingSpaces && isPatternWhiteSpace(c)) {
                continue;
            }
            stripped.appendCodePoint(c);
            skippingSpaces = c == ';';
        }
        return stripped.toString();
    }

    public String rules() {
        return rules;
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    private void parseStatement() {
        if (peek() == '!' && peek(1) == '!') {
            parseOption();
            return;
        }
        if (peek() == '$') {
            int namePos = pos;
            String name = readVariableName();
            skipIgnorable();
            if (peek() == '=') {
                pos++;
                parseAssignment(name, namePos);
                return;
            }
            pos = namePos;
        }
        parseRule();
    }

    private void parseOption() {
        int start = pos;
        pos += 2;
        int nameStart = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        String option = new String(text, nameStart, pos - nameStart);
        switch (option) {
            case "chain" -> chainRules = true;
            case "LBCMNoChain" -> lbcmNoChain = true;
            case "lookAheadHardBreak" -> lookAheadHardBreak = true;
            case "quoted_literals_only" -> quotedLiteralsOnly = true;
            case "forward" -> defaultTree = RuleTree.FORWARD;
            case "reverse" -> defaultTree = RuleTree.REVERSE;
            case "safe_forward" -> defaultTree = RuleTree.SAFE_FORWARD;
            case "safe_reverse" -> defaultTree = RuleTree.SAFE_REVERSE;
            default -> throw syntaxError(RuleErrorCode.UNRECOGNIZED_OPTION,
                    "Unrecognized option '!!" + option + "'", start);
        }
        expectSemicolon();
    }

    private void parseAssignment(String name, int namePos) {
        if (variables.containsKey(name)) {
            throw syntaxError(RuleErrorCode.VARIABLE_REDEFINITION, "Variable " + name + " is already defined", namePos);
        }
        inDefinition = true;
        lookAheadSeen = false;
        int expression = parseExpression();
        inDefinition = false;
        expectSemicolon();
        variables.put(name, expression);
    }

    private void parseRule() {
        boolean safeReverse = false;
        boolean noChainIn = false;
        if (peek() == '!') {
            safeReverse = true;
            pos++;
            skipIgnorable();
        }
        if (peek() == '^') {
            noChainIn = true;
            pos++;
            skipIgnorable();
        }

        currentRule = ++ruleCount;
        lookAheadSeen = false;
        int expression = parseExpression();
        expectSemicolon();

        if (lookAheadSeen) {
            int end = arena.add(RuleNode.endMark(currentRule, true));
            expression = arena.add(RuleNode.binary(NodeType.CAT, expression, end));
        }
        arena.get(expression).markRuleRoot(!noChainIn);

        RuleTree target = safeReverse ? RuleTree.SAFE_REVERSE : defaultTree;
        Integer existing = roots.get(target);
        roots.put(target, existing == null
                ? expression
                : arena.add(RuleNode.binary(NodeType.OR, existing, expression)));
    }

    private void expectSemicolon() {
        skipIgnorable();
        if (atEnd()) {
            throw syntaxError(RuleErrorCode.SEMICOLON_EXPECTED, "Missing ';' at end of statement", pos);
        }
        int c = peek();
        if (c == ';') {
            pos++;
            return;
        }
        if (c == ')') {
            throw syntaxError(RuleErrorCode.MISMATCHED_PAREN, "Unmatched ')'", pos);
        }
        if (c == '=') {
            throw syntaxError(RuleErrorCode.ASSIGN_ERROR, "Unexpected '='", pos);
        }
        throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Unexpected character", pos);
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private int parseExpression() {
        int left = parseSequence();
        skipIgnorable();
        while (peek() == '|') {
            pos++;
            int right = parseSequence();
            left = arena.add(RuleNode.binary(NodeType.OR, left, right));
            skipIgnorable();
        }
        return left;
    }

    private int parseSequence() {
        skipIgnorable();
        int result = RuleNode.NONE;
        while (!atEnd()) {
            int c = peek();
            if (c == '|' || c == ')' || c == ';') {
                break;
            }
            int term = parseTerm();
            result = result == RuleNode.NONE ? term : arena.add(RuleNode.binary(NodeType.CAT, result, term));
            skipIgnorable();
        }
        if (result == RuleNode.NONE) {
            throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Empty expression", pos);
        }
        return result;
    }

    private int parseTerm() {
        int node = parsePrimary();
        skipIgnorable();
        while (!atEnd()) {
            NodeType op = switch (peek()) {
                case '*' -> NodeType.STAR;
                case '+' -> NodeType.PLUS;
                case '?' -> NodeType.QUESTION;
                default -> null;
            };
            if (op == null) {
                break;
            }
            NodeType operand = arena.get(node).type();
            if (operand == NodeType.LOOK_AHEAD || operand == NodeType.TAG) {
                throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Operator cannot apply to " + operand, pos);
            }
            pos++;
            node = arena.add(RuleNode.unary(op, node));
            skipIgnorable();
        }
        return node;
    }

    private int parsePrimary() {
        int start = pos;
        int c = peek();
        switch (c) {
            case '(' -> {
                pos++;
                int inner = parseExpression();
                skipIgnorable();
                if (peek() != ')') {
                    throw syntaxError(RuleErrorCode.MISMATCHED_PAREN, "Missing ')'", start);
                }
                pos++;
                return inner;
            }
            case '[' -> {
                return setReference(setParser.parseSet(), start);
            }
            case '\\' -> {
                if (peek(1) == 'p' || peek(1) == 'P') {
                    return setReference(setParser.parsePropertyEscape(), start);
                }
                pos++;
                if (atEnd()) {
                    throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Escape at end of rules", start);
                }
                return literal(readEscape(start));
            }
            case '$' -> {
                String name = readVariableName();
                Integer definition = variables.get(name);
                if (definition == null) {
                    throw syntaxError(RuleErrorCode.UNDEFINED_VARIABLE, "Undefined variable " + name, start);
                }
                return arena.add(RuleNode.varRef(name, definition));
            }
            case '.' -> {
                pos++;
                return arena.add(RuleNode.setRef(leafFor(ANY_SET_TEXT, CodePointSet.all(), false, false).index()));
            }
            case '\'' -> {
                return quotedLiteral(start);
            }
            case '/' -> {
                if (inDefinition) {
                    throw syntaxError(RuleErrorCode.RULE_SYNTAX, "'/' is not allowed in a variable definition", start);
                }
                if (lookAheadSeen) {
                    throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Only one '/' is allowed per rule", start);
                }
                pos++;
                lookAheadSeen = true;
                return arena.add(RuleNode.lookAhead(currentRule));
            }
            case '{' -> {
                return statusTag(start);
            }
            case '=' -> throw syntaxError(RuleErrorCode.ASSIGN_ERROR, "Unexpected '='", start);
            case ']', '}', '!', '^', '*', '+', '?' ->
                    throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Unexpected '" + Character.toString(c) + "'", start);
            default -> {
                if (quotedLiteralsOnly) {
                    throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Unquoted literal with !!quoted_literals_only", start);
                }
                pos++;
                return literal(c);
            }
        }
    }

    private int quotedLiteral(int start) {
        pos++;
        if (peek() == '\'') {
            pos++;
            return literal('\'');
        }
        int result = RuleNode.NONE;
        while (true) {
            if (atEnd()) {
                throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Unterminated quoted literal", start);
            }
            int c = text[pos];
            if (isNewline(c)) {
                throw syntaxError(RuleErrorCode.NEW_LINE_IN_QUOTED_STRING, "New line in quoted literal", pos);
            }
            if (c == '\'') {
                if (peek(1) != '\'') {
                    pos++;
                    break;
                }
                pos++;
            }
            pos++;
            int leaf = literal(c);
            result = result == RuleNode.NONE ? leaf : arena.add(RuleNode.binary(NodeType.CAT, result, leaf));
        }
        return result;
    }

    private int statusTag(int start) {
        pos++;
        int digitsStart = pos;
        while (!atEnd() && peek() >= '0' && peek() <= '9') {
            pos++;
        }
        int digits = pos - digitsStart;
        if (digits == 0 || digits > 10 || peek() != '}') {
            throw syntaxError(RuleErrorCode.MALFORMED_RULE_TAG, "Status tag must be {digits}", start);
        }
        long value = Long.parseLong(new String(text, digitsStart, digits));
        if (value > Integer.MAX_VALUE) {
            throw syntaxError(RuleErrorCode.MALFORMED_RULE_TAG, "Status tag value too large", start);
        }
        pos++;
        int tag = (int) value;
        if (!statusValues.contains(tag)) {
            statusValues.add(tag);
        }
        return arena.add(RuleNode.tag(tag));
    }

    private int literal(int codePoint) {
        String key = new String(Character.toChars(codePoint));
        return arena.add(RuleNode.setRef(leafFor(key, CodePointSet.of(codePoint), false, false).index()));
    }

    private int setReference(SetParser.SetValue value, int start) {
        String source = new String(text, start, pos - start);
        if (value.codePoints().isEmpty() && !value.beginOfText() && !value.endOfText()) {
            throw syntaxError(RuleErrorCode.RULE_EMPTY_SET, "Set " + source + " is empty", start);
        }
        SetLeaf leaf = leafFor(source, value.codePoints(), value.beginOfText(), value.endOfText());
        return arena.add(RuleNode.setRef(leaf.index()));
    }

    private SetLeaf leafFor(String sourceText, CodePointSet codePoints, boolean bof, boolean eof) {
        return setLeavesByText.computeIfAbsent(sourceText, key -> {
            SetLeaf leaf = new SetLeaf(setLeaves.size(), key, codePoints, bof, eof);
            setLeaves.add(leaf);
            return leaf;
        });
    }

    // ------------------------------------------------------------------
    // Shared with SetParser
    // ------------------------------------------------------------------

    /**
     * Reads {@code $name} starting at the {@code $}.
     */
    String readVariableName() {
        int start = pos;
        pos++;
        if (atEnd() || !UCharacter.isUnicodeIdentifierStart(peek())) {
            throw syntaxError(RuleErrorCode.RULE_SYNTAX, "Missing variable name after '$'", start);
        }
        while (!atEnd() && UCharacter.isUnicodeIdentifierPart(peek())) {
            pos++;
        }
        return new String(text, start, pos - start);
    }

    /**
     * Looks up a variable used inside a set expression; its definition must be a set.
     */
    SetLeaf setVariable(String name, int at) {
        Integer definition = variables.get(name);
        if (definition == null) {
            throw syntaxError(RuleErrorCode.UNDEFINED_VARIABLE, "Undefined variable " + name, at);
        }
        RuleNode node = arena.get(definition);
        while (node.type() == NodeType.VAR_REF) {
            node = arena.get(node.left());
        }
        if (node.type() != NodeType.SET_REF) {
            throw syntaxError(RuleErrorCode.MALFORMED_SET, "Variable " + name + " is not a set", at);
        }
        return setLeaves.get(node.setLeaf());
    }

    /**
     * Decodes an escape; {@code pos} is just past the backslash at {@code escapeStart}.
     */
    int readEscape(int escapeStart) {
        int c = text[pos++];
        return switch (c) {
            case 'u' -> readHex(4, 4, escapeStart);
            case 'U' -> readHex(8, 8, escapeStart);
            case 'x' -> {
                if (peek() == '{') {
                    pos++;
                    int value = readHex(1, 6, escapeStart);
                    if (peek() != '}') {
                        throw syntaxError(RuleErrorCode.HEX_DIGITS_EXPECTED, "Missing '}' in \\x{...}", escapeStart);
                    }
                    pos++;
                    yield value;
                }
                yield readHex(1, 2, escapeStart);
            }
            case 't' -> '\t';
            case 'n' -> '\n';
            case 'r' -> '\r';
            case 'f' -> '\f';
            case 'a' -> 0x07;
            case 'e' -> 0x1B;
            case 'v' -> 0x0B;
            default -> c;
        };
    }

    private int readHex(int minDigits, int maxDigits, int escapeStart) {
        int value = 0;
        int digits = 0;
        while (digits < maxDigits && !atEnd() && Character.digit(peek(), 16) >= 0) {
            value = (value << 4) | Character.digit(peek(), 16);
            pos++;
            digits++;
        }
        if (digits < minDigits) {
            throw syntaxError(RuleErrorCode.HEX_DIGITS_EXPECTED, "Expected " + minDigits + " hex digits", escapeStart);
        }
        if (value < 0 || value > Character.MAX_CODE_POINT) {
            throw syntaxError(RuleErrorCode.HEX_DIGITS_EXPECTED, "Escaped value exceeds U+10FFFF", escapeStart);
        }
        return value;
    }

    void skipIgnorable() {
        while (!atEnd()) {
            int c = text[pos];
            if (isPatternWhiteSpace(c)) {
                pos++;
            } else if (c == '#') {
                while (!atEnd() && !isNewline(text[pos])) {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    boolean atEnd() {
        return pos >= text.length;
    }

    int peek() {
        return peek(0);
    }

    int peek(int ahead) {
        int i = pos + ahead;
        return i < text.length ? text[i] : -1;
    }

    int at(int index) {
        return index < text.length ? text[index] : -1;
    }

    /** UTF-16 index in {@link #rules()} of the code point at {@code index}. */
    int charIndex(int index) {
        return rules.offsetByCodePoints(0, index);
    }

    int codePointIndex(int charIndex) {
        return rules.codePointCount(0, charIndex);
    }

    String source(int start, int end) {
        return new String(text, start, end - start);
    }

    int length() {
        return text.length;
    }

    /**
     * Builds a syntax error located at code point index {@code index}.
     */
    RuleSyntaxException syntaxError(RuleErrorCode code, String message, int index) {
        return new RuleSyntaxException(code, message, locate(index));
    }

    ParseErrorLocation locate(int index) {
        int at = Math.min(index, text.length);
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < at; i++) {
            int c = text[i];
            if (c == '\r' || c == 0x85 || c == 0x2028 || c == 0x2029) {
                line++;
                lineStart = i + 1;
            } else if (c == '\n') {
                if (i == 0 || text[i - 1] != '\r') {
                    line++;
                }
                lineStart = i + 1;
            }
        }
        int preStart = Math.max(0, at - ParseErrorLocation.MAX_CONTEXT);
        int postEnd = Math.min(text.length, at + ParseErrorLocation.MAX_CONTEXT);
        return new ParseErrorLocation(line, at - lineStart, source(preStart, at), source(at, postEnd));
    }

    static boolean isNewline(int c) {
        return c == '\n' || c == '\r' || c == 0x85 || c == 0x2028 || c == 0x2029;
    }

    static boolean isPatternWhiteSpace(int c) {
        return c >= 0 && UCharacter.hasBinaryProperty(c, UProperty.PATTERN_WHITE_SPACE);
    }
}
