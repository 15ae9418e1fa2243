package org.ergoplatform.ergoscript.lang;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.ergoplatform.ergoscript.data.Coll;

/**
 * Recursive-descent parser that resolves names and assigns types while it builds the tree, so its
 * output is already the typed {@link Expr} the evaluator runs.
 *
 * <p>Statements are newline separated. A call or index suffix must start on the line of its
 * receiver, while a {@code .member} or a binary operator other than {@code -} may continue an
 * expression on the next line.
 */
final class Parser {
    private static final Set<TokenType> CONTINUATION_OPERATORS = EnumSet.of(
        TokenType.AND_AND, TokenType.OR_OR, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
        TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
        TokenType.PLUS, TokenType.STAR, TokenType.SLASH, TokenType.PERCENT
    );
    private static final Map<String, SType> PRE_HEADER_PROPERTIES = Map.of(
        "version", SType.BYTE,
        "parentId", SType.BYTES,
        "timestamp", SType.LONG,
        "nBits", SType.LONG,
        "height", SType.INT,
        "minerPk", SType.GROUP_ELEMENT,
        "votes", SType.BYTES
    );

    private final Lexer lexer;
    private final List<Token> tokens;
    private final Deque<Map<String, Binding>> scopes = new ArrayDeque<>();
    private int current;
    private int nextId = 1;

    Parser(String source) {
        this.lexer = new Lexer(source);
        this.tokens = lexer.tokenize();
    }

    record Binding(int id, SType type, int placeholderIndex) {
    }

    record TemplateParameter(String name, SType type, Optional<Object> defaultValue) {
    }

    record TemplateHeader(String name, List<TemplateParameter> parameters) {
    }

    record ParsedContract(Expr body, Optional<TemplateHeader> template) {
    }

    /**
     * Parses a whole compilation unit: optional top-level definitions followed by either an
     * {@code @contract} template or the contract expression.
     */
    ParsedContract parse() {
        scopes.push(new HashMap<>());
        var start = ctx(peek());
        var preamble = new ArrayList<Expr.ValDef>();
        while (true) {
            skipSemicolons();
            if (check(TokenType.VAL)) {
                preamble.add(parseVal());
            } else if (check(TokenType.DEF)) {
                preamble.add(parseDef());
            } else {
                break;
            }
            expectStatementEnd(TokenType.EOF);
        }
        if (check(TokenType.AT) && peekAt(1).type() == TokenType.IDENTIFIER && "contract".equals(peekAt(1).lexeme())) {
            var template = parseTemplate();
            if (preamble.isEmpty()) {
                return template;
            }
            return new ParsedContract(new Expr.BlockValue(preamble, template.body(), start), template.template());
        }
        var body = parseBlockBody(TokenType.EOF, start, preamble);
        return new ParsedContract(body, Optional.empty());
    }

    private ParsedContract parseTemplate() {
        advance();
        advance();
        consume(TokenType.DEF, "Expected 'def' after @contract");
        var name = consume(TokenType.IDENTIFIER, "Expected contract name");
        consume(TokenType.LEFT_PAREN, "Expected '(' after contract name");
        var parameters = new ArrayList<TemplateParameter>();
        while (!check(TokenType.RIGHT_PAREN)) {
            var paramName = consume(TokenType.IDENTIFIER, "Expected parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter " + paramName.lexeme());
            var type = parseType();
            Optional<Object> defaultValue = Optional.empty();
            if (match(TokenType.EQUAL)) {
                var at = peek();
                var value = coerce(parseExpression(), type, at);
                if (!(value instanceof Expr.Constant constant)) {
                    throw error(at, "Default value of parameter '" + paramName.lexeme() + "' must be a constant");
                }
                defaultValue = Optional.of(constant.value());
            }
            declare(paramName, new Binding(nextId++, type, parameters.size()));
            parameters.add(new TemplateParameter(paramName.lexeme(), type, defaultValue));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after contract parameters");
        SType declared = match(TokenType.COLON) ? parseType() : null;
        consume(TokenType.EQUAL, "Expected '=' before contract body");
        var bodyStart = peek();
        var body = parseExpression();
        if (declared != null) {
            body = coerce(body, declared, bodyStart);
        }
        skipSemicolons();
        if (!check(TokenType.EOF)) {
            throw error(peek(), "Unexpected '" + peek().lexeme() + "' after contract template");
        }
        return new ParsedContract(body, Optional.of(new TemplateHeader(name.lexeme(), parameters)));
    }

    private Expr parseBlockBody(TokenType terminator, SourceContext blockContext) {
        return parseBlockBody(terminator, blockContext, List.of());
    }

    private Expr parseBlockBody(TokenType terminator, SourceContext blockContext, List<Expr.ValDef> leading) {
        scopes.push(new HashMap<>());
        try {
            var items = new ArrayList<Expr.ValDef>(leading);
            Expr result = null;
            while (true) {
                skipSemicolons();
                if (check(terminator) || check(TokenType.EOF)) {
                    break;
                }
                if (result != null) {
                    throw error(peek(), "Only the last statement of a block may be an expression");
                }
                if (check(TokenType.VAL)) {
                    items.add(parseVal());
                } else if (check(TokenType.DEF)) {
                    items.add(parseDef());
                } else {
                    result = parseExpression();
                }
                expectStatementEnd(terminator);
            }
            if (result == null) {
                throw error(peek(), "Block must end with an expression");
            }
            return items.isEmpty() ? result : new Expr.BlockValue(items, result, blockContext);
        } finally {
            scopes.pop();
        }
    }

    private void expectStatementEnd(TokenType terminator) {
        var next = peek();
        if (next.type() == TokenType.SEMICOLON || next.type() == terminator || next.type() == TokenType.EOF
            || next.newlineBefore()) {
            return;
        }
        throw error(next, "Expected end of statement but found '" + next.lexeme() + "'");
    }

    private Expr.ValDef parseVal() {
        var keyword = advance();
        var name = consume(TokenType.IDENTIFIER, "Expected name after 'val'");
        SType declared = match(TokenType.COLON) ? parseType() : null;
        consume(TokenType.EQUAL, "Expected '=' after val " + name.lexeme());
        var at = peek();
        var rhs = parseExpression();
        if (declared != null) {
            rhs = coerce(rhs, declared, at);
        }
        int id = nextId++;
        declare(name, new Binding(id, rhs.type(), -1));
        return new Expr.ValDef(id, name.lexeme(), rhs, ctx(keyword));
    }

    private Expr.ValDef parseDef() {
        var keyword = advance();
        var name = consume(TokenType.IDENTIFIER, "Expected name after 'def'");
        var args = new ArrayList<Expr.FuncArg>();
        boolean hasParams = match(TokenType.LEFT_PAREN);
        if (hasParams) {
            while (!check(TokenType.RIGHT_PAREN)) {
                var argName = consume(TokenType.IDENTIFIER, "Expected parameter name");
                consume(TokenType.COLON, "Expected ':' after parameter " + argName.lexeme());
                args.add(new Expr.FuncArg(nextId++, argName.lexeme(), parseType()));
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters of " + name.lexeme());
        }
        SType declared = match(TokenType.COLON) ? parseType() : null;
        consume(TokenType.EQUAL, "Expected '=' in definition of " + name.lexeme());
        var at = peek();
        Expr rhs;
        if (hasParams) {
            scopes.push(new HashMap<>());
            try {
                for (var arg : args) {
                    scopes.peek().put(arg.name(), new Binding(arg.id(), arg.type(), -1));
                }
                var body = parseExpression();
                if (declared != null) {
                    body = coerce(body, declared, at);
                }
                rhs = new Expr.FuncValue(args, body, ctx(keyword));
            } finally {
                scopes.pop();
            }
        } else {
            rhs = parseExpression();
            if (declared != null) {
                rhs = coerce(rhs, declared, at);
            }
        }
        int id = nextId++;
        declare(name, new Binding(id, rhs.type(), -1));
        return new Expr.ValDef(id, name.lexeme(), rhs, ctx(keyword));
    }

    private Expr parseExpression() {
        return parseOr();
    }

    private Expr parseOr() {
        var expr = parseAnd();
        while (matchOperator(TokenType.OR_OR)) {
            var op = previous();
            expr = logical(OpCode.BIN_OR, OpCode.SIGMA_OR, expr, parseAnd(), op);
        }
        return expr;
    }

    private Expr parseAnd() {
        var expr = parseEquality();
        while (matchOperator(TokenType.AND_AND)) {
            var op = previous();
            expr = logical(OpCode.BIN_AND, OpCode.SIGMA_AND, expr, parseEquality(), op);
        }
        return expr;
    }

    private Expr parseEquality() {
        var expr = parseComparison();
        while (matchOperator(TokenType.EQUAL_EQUAL) || matchOperator(TokenType.BANG_EQUAL)) {
            var op = previous();
            var code = op.type() == TokenType.EQUAL_EQUAL ? OpCode.EQ : OpCode.NEQ;
            expr = equality(code, expr, parseComparison(), op);
        }
        return expr;
    }

    private Expr parseComparison() {
        var expr = parseAdditive();
        while (matchOperator(TokenType.GREATER) || matchOperator(TokenType.GREATER_EQUAL)
            || matchOperator(TokenType.LESS) || matchOperator(TokenType.LESS_EQUAL)) {
            var op = previous();
            var code = switch (op.type()) {
                case GREATER -> OpCode.GT;
                case GREATER_EQUAL -> OpCode.GE;
                case LESS -> OpCode.LT;
                default -> OpCode.LE;
            };
            var right = parseAdditive();
            requireNumeric(expr, op);
            requireNumeric(right, op);
            var type = SType.widest(expr.type(), right.type());
            expr = new Expr.BinaryOp(code, widen(expr, type, op), widen(right, type, op), SType.BOOLEAN, ctx(op));
        }
        return expr;
    }

    private Expr parseAdditive() {
        var expr = parseMultiplicative();
        while (matchOperator(TokenType.PLUS) || matchOperator(TokenType.MINUS)) {
            var op = previous();
            expr = arithmetic(op.type() == TokenType.PLUS ? OpCode.PLUS : OpCode.MINUS, expr, parseMultiplicative(), op);
        }
        return expr;
    }

    private Expr parseMultiplicative() {
        var expr = parseUnary();
        while (matchOperator(TokenType.STAR) || matchOperator(TokenType.SLASH) || matchOperator(TokenType.PERCENT)) {
            var op = previous();
            var code = switch (op.type()) {
                case STAR -> OpCode.MULTIPLY;
                case SLASH -> OpCode.DIVISION;
                default -> OpCode.MODULO;
            };
            expr = arithmetic(code, expr, parseUnary(), op);
        }
        return expr;
    }

    private Expr parseUnary() {
        if (match(TokenType.BANG)) {
            var op = previous();
            var operand = parseUnary();
            requireType(operand, SType.BOOLEAN, op);
            return new Expr.UnaryOp(OpCode.LOGICAL_NOT, operand, SType.BOOLEAN, ctx(op));
        }
        if (match(TokenType.MINUS)) {
            var op = previous();
            var operand = parseUnary();
            requireNumeric(operand, op);
            if (operand instanceof Expr.Constant constant) {
                return new Expr.Constant(operand.type(), negateConstant(constant, op), ctx(op));
            }
            return new Expr.UnaryOp(OpCode.NEGATION, operand, operand.type(), ctx(op));
        }
        return parsePostfix();
    }

    private Object negateConstant(Expr.Constant constant, Token op) {
        try {
            return Numerics.negate(constant.value(), constant.type());
        } catch (ArithmeticException e) {
            throw error(op, e.getMessage());
        }
    }

    private Expr parsePostfix() {
        var expr = parsePrimary();
        while (true) {
            if (match(TokenType.DOT)) {
                var name = consume(TokenType.IDENTIFIER, "Expected member name after '.'");
                expr = member(expr, name);
            } else if (check(TokenType.LEFT_PAREN) && !peek().newlineBefore()) {
                expr = call(expr, advance());
            } else {
                return expr;
            }
        }
    }

    private Expr parsePrimary() {
        var token = advance();
        switch (token.type()) {
            case INT:
                return new Expr.Constant(SType.INT, token.literal(), ctx(token));
            case LONG:
                return new Expr.Constant(SType.LONG, token.literal(), ctx(token));
            case TRUE:
                return new Expr.Constant(SType.BOOLEAN, Boolean.TRUE, ctx(token));
            case FALSE:
                return new Expr.Constant(SType.BOOLEAN, Boolean.FALSE, ctx(token));
            case STRING:
                return new Expr.Constant(SType.STRING, token.literal(), ctx(token));
            case IF:
                return parseIf(token);
            case LEFT_PAREN: {
                if (isParenLambda(current - 1)) {
                    current--;
                    return parseLambda(false, List.of());
                }
                var first = parseExpression();
                if (match(TokenType.COMMA)) {
                    var second = parseExpression();
                    consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple");
                    return new Expr.TupleExpr(first, second, ctx(token));
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')'");
                return first;
            }
            case LEFT_BRACE: {
                if (isParenLambda(current)) {
                    current--;
                    return parseLambda(true, List.of());
                }
                var block = parseBlockBody(TokenType.RIGHT_BRACE, ctx(token));
                consume(TokenType.RIGHT_BRACE, "Expected '}' to close block opened at line " + token.line());
                return block;
            }
            case IDENTIFIER:
                return identifier(token);
            default:
                throw error(token, token.type() == TokenType.EOF
                    ? "Unexpected end of input"
                    : "Unexpected '" + token.lexeme() + "'");
        }
    }

    private Expr parseIf(Token keyword) {
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        var at = peek();
        var condition = parseExpression();
        requireType(condition, SType.BOOLEAN, at);
        consume(TokenType.RIGHT_PAREN, "Expected ')' after if condition");
        var thenBranch = parseExpression();
        consume(TokenType.ELSE, "Expected 'else' branch of if expression");
        var elseBranch = parseExpression();
        SType type;
        if (thenBranch.type().equals(elseBranch.type())) {
            type = thenBranch.type();
        } else if (SType.isNumeric(thenBranch.type()) && SType.isNumeric(elseBranch.type())) {
            type = SType.widest(thenBranch.type(), elseBranch.type());
            thenBranch = widen(thenBranch, type, keyword);
            elseBranch = widen(elseBranch, type, keyword);
        } else {
            throw error(keyword, "Branches of if have different types: " + thenBranch.type() + " and " + elseBranch.type());
        }
        return new Expr.If(condition, thenBranch, elseBranch, type, ctx(keyword));
    }

    private Expr identifier(Token token) {
        var name = token.lexeme();
        var binding = lookup(name);
        if (binding != null) {
            if (binding.placeholderIndex() >= 0) {
                return new Expr.ConstantPlaceholder(binding.placeholderIndex(), binding.type(), ctx(token));
            }
            return new Expr.ValUse(binding.id(), name, binding.type(), ctx(token));
        }
        switch (name) {
            case "HEIGHT":
                return new Expr.ContextProperty(OpCode.HEIGHT, SType.INT, ctx(token));
            case "SELF":
                return new Expr.ContextProperty(OpCode.SELF, SType.BOX, ctx(token));
            case "INPUTS":
                return new Expr.ContextProperty(OpCode.INPUTS, new SType.SColl(SType.BOX), ctx(token));
            case "OUTPUTS":
                return new Expr.ContextProperty(OpCode.OUTPUTS, new SType.SColl(SType.BOX), ctx(token));
            case "CONTEXT":
                return contextMember(token);
            case "sigmaProp", "allOf", "anyOf", "fromBase16", "decodePoint", "proveDlog", "Coll":
                return builtin(token);
            default:
                throw error(token, "Cannot resolve symbol '" + name + "'");
        }
    }

    private Expr contextMember(Token context) {
        consume(TokenType.DOT, "Expected '.' after CONTEXT");
        var member = consume(TokenType.IDENTIFIER, "Expected member name after 'CONTEXT.'");
        return switch (member.lexeme()) {
            case "dataInputs" -> new Expr.ContextProperty(OpCode.DATA_INPUTS, new SType.SColl(SType.BOX), ctx(member));
            case "preHeader" -> new Expr.ContextProperty(OpCode.PRE_HEADER, SType.PRE_HEADER, ctx(member));
            case "HEIGHT" -> new Expr.ContextProperty(OpCode.HEIGHT, SType.INT, ctx(member));
            case "SELF" -> new Expr.ContextProperty(OpCode.SELF, SType.BOX, ctx(member));
            case "INPUTS" -> new Expr.ContextProperty(OpCode.INPUTS, new SType.SColl(SType.BOX), ctx(member));
            case "OUTPUTS" -> new Expr.ContextProperty(OpCode.OUTPUTS, new SType.SColl(SType.BOX), ctx(member));
            default -> throw error(member, "Unknown member '" + member.lexeme() + "' on type " + SType.CONTEXT);
        };
    }

    private Expr builtin(Token token) {
        var name = token.lexeme();
        if ("Coll".equals(name)) {
            return collectionLiteral(token);
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after " + name);
        var args = parseArguments();
        if (args.size() != 1) {
            throw error(token, name + " expects 1 argument, got " + args.size());
        }
        var arg = args.get(0);
        switch (name) {
            case "sigmaProp":
                if (SType.SIGMA_PROP.equals(arg.type())) {
                    return arg;
                }
                requireType(arg, SType.BOOLEAN, token);
                return new Expr.UnaryOp(OpCode.BOOL_TO_SIGMA_PROP, arg, SType.SIGMA_PROP, ctx(token));
            case "allOf":
            case "anyOf":
                requireType(arg, new SType.SColl(SType.BOOLEAN), token);
                return new Expr.UnaryOp("allOf".equals(name) ? OpCode.AND : OpCode.OR, arg, SType.BOOLEAN, ctx(token));
            case "fromBase16":
                if (!(arg instanceof Expr.Constant constant) || !SType.STRING.equals(arg.type())) {
                    throw error(token, "fromBase16 expects a string literal");
                }
                try {
                    return new Expr.Constant(SType.BYTES, Coll.fromHex((String) constant.value()), ctx(token));
                } catch (IllegalArgumentException e) {
                    throw error(token, "Invalid hex string in fromBase16: " + e.getMessage());
                }
            case "decodePoint":
                requireType(arg, SType.BYTES, token);
                return new Expr.UnaryOp(OpCode.DECODE_POINT, arg, SType.GROUP_ELEMENT, ctx(token));
            default:
                requireType(arg, SType.GROUP_ELEMENT, token);
                return new Expr.UnaryOp(OpCode.PROVE_DLOG, arg, SType.SIGMA_PROP, ctx(token));
        }
    }

    private Expr collectionLiteral(Token token) {
        SType elemType = null;
        if (match(TokenType.LEFT_BRACKET)) {
            elemType = parseType();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after Coll element type");
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' after Coll");
        var items = parseArguments();
        if (elemType == null) {
            if (items.isEmpty()) {
                throw error(token, "Cannot infer element type of empty Coll, use Coll[T]()");
            }
            elemType = items.get(0).type();
            for (var item : items) {
                if (SType.isNumeric(elemType) && SType.isNumeric(item.type())) {
                    elemType = SType.widest(elemType, item.type());
                }
            }
        }
        var coerced = new ArrayList<Expr>();
        for (var item : items) {
            coerced.add(coerce(item, elemType, token));
        }
        return new Expr.ConcreteCollection(coerced, elemType, ctx(token));
    }

    private List<Expr> parseArguments() {
        var args = new ArrayList<Expr>();
        while (!check(TokenType.RIGHT_PAREN)) {
            args.add(parseExpression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
        return args;
    }

    private Expr call(Expr target, Token paren) {
        var args = parseArguments();
        var source = target.source().orElse(ctx(paren));
        if (target.type() instanceof SType.SFunc func) {
            if (args.size() != func.args().size()) {
                throw error(paren, "Function expects " + func.args().size() + " arguments, got " + args.size());
            }
            var coerced = new ArrayList<Expr>();
            for (int i = 0; i < args.size(); i++) {
                coerced.add(coerce(args.get(i), func.args().get(i), paren));
            }
            return new Expr.Apply(target, coerced, func.result(), source);
        }
        if (target.type() instanceof SType.SColl coll) {
            if (args.size() != 1) {
                throw error(paren, "Collection index expects 1 argument, got " + args.size());
            }
            var index = coerce(args.get(0), SType.INT, paren);
            return new Expr.BinaryOp(OpCode.BY_INDEX, target, index, coll.elem(), ctx(paren));
        }
        throw error(paren, "Value of type " + target.type() + " cannot be applied to arguments");
    }

    private Expr member(Expr receiver, Token name) {
        var member = name.lexeme();
        var type = receiver.type();
        var at = ctx(name);
        if (SType.BOX.equals(type)) {
            switch (member) {
                case "value":
                    return new Expr.UnaryOp(OpCode.EXTRACT_AMOUNT, receiver, SType.LONG, at);
                case "id":
                    return new Expr.UnaryOp(OpCode.EXTRACT_ID, receiver, SType.BYTES, at);
                case "creationInfo":
                    return new Expr.UnaryOp(OpCode.EXTRACT_CREATION_INFO, receiver, new SType.STuple(SType.INT, SType.BYTES), at);
                case "tokens":
                    return new Expr.UnaryOp(OpCode.TOKENS, receiver, new SType.SColl(new SType.STuple(SType.BYTES, SType.LONG)), at);
                default:
                    if (member.matches("R[4-9]")) {
                        consume(TokenType.LEFT_BRACKET, "Expected '[' with the type of register " + member);
                        var elemType = parseType();
                        consume(TokenType.RIGHT_BRACKET, "Expected ']' after register type");
                        return new Expr.ExtractRegisterAs(receiver, member.charAt(1) - '0', elemType, at);
                    }
            }
        } else if (type instanceof SType.SColl coll) {
            switch (member) {
                case "size":
                    return new Expr.UnaryOp(OpCode.SIZE_OF, receiver, SType.INT, at);
                case "map", "filter", "exists", "forall", "flatMap", "fold":
                    return collectionOp(receiver, coll, name);
                default:
                    break;
            }
        } else if (type instanceof SType.SOption option) {
            switch (member) {
                case "get":
                    return new Expr.UnaryOp(OpCode.OPTION_GET, receiver, option.elem(), at);
                case "isDefined":
                    return new Expr.UnaryOp(OpCode.OPTION_IS_DEFINED, receiver, SType.BOOLEAN, at);
                case "isEmpty":
                    return new Expr.UnaryOp(OpCode.LOGICAL_NOT,
                        new Expr.UnaryOp(OpCode.OPTION_IS_DEFINED, receiver, SType.BOOLEAN, at), SType.BOOLEAN, at);
                case "getOrElse": {
                    consume(TokenType.LEFT_PAREN, "Expected '(' after getOrElse");
                    var args = parseArguments();
                    if (args.size() != 1) {
                        throw error(name, "getOrElse expects 1 argument, got " + args.size());
                    }
                    var fallback = coerce(args.get(0), option.elem(), name);
                    return new Expr.BinaryOp(OpCode.OPTION_GET_OR_ELSE, receiver, fallback, option.elem(), at);
                }
                default:
                    break;
            }
        } else if (type instanceof SType.STuple tuple) {
            if ("_1".equals(member)) {
                return new Expr.SelectField(receiver, 1, tuple.first(), at);
            }
            if ("_2".equals(member)) {
                return new Expr.SelectField(receiver, 2, tuple.second(), at);
            }
        } else if (SType.PRE_HEADER.equals(type)) {
            var propertyType = PRE_HEADER_PROPERTIES.get(member);
            if (propertyType != null) {
                return new Expr.PropertyCall(receiver, member, propertyType, at);
            }
        } else if (SType.isNumeric(type)) {
            var target = switch (member) {
                case "toByte" -> SType.BYTE;
                case "toInt" -> SType.INT;
                case "toLong" -> SType.LONG;
                case "toBigInt" -> SType.BIGINT;
                default -> null;
            };
            if (target != null) {
                return numericCast(receiver, target, name);
            }
        }
        throw error(name, "Unknown member '" + member + "' on type " + type);
    }

    private Expr numericCast(Expr receiver, SType target, Token at) {
        int from = SType.numericRank(receiver.type());
        int to = SType.numericRank(target);
        if (from == to) {
            return receiver;
        }
        if (from < to) {
            return upcast(receiver, target, ctx(at));
        }
        return new Expr.UnaryOp(OpCode.DOWNCAST, receiver, target, ctx(at));
    }

    private Expr collectionOp(Expr receiver, SType.SColl coll, Token name) {
        var op = switch (name.lexeme()) {
            case "map" -> OpCode.MAP;
            case "filter" -> OpCode.FILTER;
            case "exists" -> OpCode.EXISTS;
            case "forall" -> OpCode.FOR_ALL;
            case "flatMap" -> OpCode.FLAT_MAP;
            default -> OpCode.FOLD;
        };
        boolean parens = match(TokenType.LEFT_PAREN);
        if (!parens && !check(TokenType.LEFT_BRACE)) {
            throw error(name, "Expected arguments for " + name.lexeme());
        }
        Expr zero = null;
        if (op == OpCode.FOLD) {
            if (!parens) {
                throw error(name, "fold expects (zero, function) arguments");
            }
            zero = parseExpression();
            consume(TokenType.COMMA, "Expected ',' after fold initial value");
        }
        var expected = zero == null ? List.of(coll.elem()) : List.of(zero.type(), coll.elem());
        var func = parseFunctionArgument(expected, name);
        if (parens) {
            consume(TokenType.RIGHT_PAREN, "Expected ')' after " + name.lexeme() + " arguments");
        }
        var funcType = (SType.SFunc) func.type();
        if (!funcType.args().equals(expected)) {
            throw error(name, name.lexeme() + " expects a function of " + expected + ", got " + funcType);
        }
        var result = funcType.result();
        SType type = switch (op) {
            case MAP -> new SType.SColl(result);
            case FILTER -> {
                requireResult(result, SType.BOOLEAN, name);
                yield coll;
            }
            case EXISTS, FOR_ALL -> {
                requireResult(result, SType.BOOLEAN, name);
                yield SType.BOOLEAN;
            }
            case FLAT_MAP -> {
                if (!(result instanceof SType.SColl)) {
                    throw error(name, "flatMap function must return a collection, got " + result);
                }
                yield result;
            }
            default -> {
                requireResult(result, zero.type(), name);
                yield zero.type();
            }
        };
        return new Expr.CollectionOp(op, receiver, zero, func, type, ctx(name));
    }

    private void requireResult(SType actual, SType expected, Token at) {
        if (!actual.equals(expected)) {
            throw error(at, at.lexeme() + " function must return " + expected + ", got " + actual);
        }
    }

    private Expr parseFunctionArgument(List<SType> expected, Token owner) {
        if (check(TokenType.LEFT_BRACE) && isParenLambda(current + 1)) {
            return parseLambda(true, expected);
        }
        if (check(TokenType.LEFT_PAREN) && isParenLambda(current)) {
            return parseLambda(false, expected);
        }
        var func = parseExpression();
        if (!(func.type() instanceof SType.SFunc)) {
            throw error(owner, owner.lexeme() + " expects a function argument, got " + func.type());
        }
        return func;
    }

    private boolean isParenLambda(int position) {
        if (position >= tokens.size() || tokens.get(position).type() != TokenType.LEFT_PAREN) {
            return false;
        }
        int depth = 0;
        for (int i = position; i < tokens.size(); i++) {
            var type = tokens.get(i).type();
            if (type == TokenType.LEFT_PAREN) {
                depth++;
            } else if (type == TokenType.RIGHT_PAREN) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.ARROW;
                }
            } else if (type == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private Expr parseLambda(boolean braced, List<SType> expected) {
        var start = peek();
        if (braced) {
            advance();
        }
        consume(TokenType.LEFT_PAREN, "Expected '(' to start lambda parameters");
        var args = new ArrayList<Expr.FuncArg>();
        while (!check(TokenType.RIGHT_PAREN)) {
            var argName = consume(TokenType.IDENTIFIER, "Expected lambda parameter name");
            SType type;
            if (match(TokenType.COLON)) {
                type = parseType();
            } else if (args.size() < expected.size()) {
                type = expected.get(args.size());
            } else {
                throw error(argName, "Missing type for lambda parameter '" + argName.lexeme() + "'");
            }
            args.add(new Expr.FuncArg(nextId++, argName.lexeme(), type));
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after lambda parameters");
        var arrow = consume(TokenType.ARROW, "Expected '=>' in lambda");
        scopes.push(new HashMap<>());
        try {
            for (var arg : args) {
                scopes.peek().put(arg.name(), new Binding(arg.id(), arg.type(), -1));
            }
            Expr body;
            if (braced) {
                body = parseBlockBody(TokenType.RIGHT_BRACE, ctx(arrow));
                consume(TokenType.RIGHT_BRACE, "Expected '}' to close lambda");
            } else {
                body = parseExpression();
            }
            return new Expr.FuncValue(args, body, ctx(start));
        } finally {
            scopes.pop();
        }
    }

    private SType parseType() {
        if (match(TokenType.LEFT_PAREN)) {
            var first = parseType();
            consume(TokenType.COMMA, "Expected ',' in tuple type");
            var second = parseType();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after tuple type");
            return new SType.STuple(first, second);
        }
        var name = consume(TokenType.IDENTIFIER, "Expected type name");
        if ("Coll".equals(name.lexeme()) || "Option".equals(name.lexeme())) {
            consume(TokenType.LEFT_BRACKET, "Expected '[' after " + name.lexeme());
            var elem = parseType();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after type argument");
            return "Coll".equals(name.lexeme()) ? new SType.SColl(elem) : new SType.SOption(elem);
        }
        var type = SType.byName(name.lexeme());
        if (type == null) {
            throw error(name, "Unknown type '" + name.lexeme() + "'");
        }
        return type;
    }

    private Expr logical(OpCode boolOp, OpCode sigmaOp, Expr left, Expr right, Token op) {
        if (SType.BOOLEAN.equals(left.type()) && SType.BOOLEAN.equals(right.type())) {
            return new Expr.BinaryOp(boolOp, left, right, SType.BOOLEAN, ctx(op));
        }
        if (isLogical(left.type()) && isLogical(right.type())) {
            return new Expr.BinaryOp(sigmaOp, toSigmaProp(left), toSigmaProp(right), SType.SIGMA_PROP, ctx(op));
        }
        throw error(op, "Operator " + op.lexeme() + " expects Boolean or SigmaProp operands, got "
            + left.type() + " and " + right.type());
    }

    private static boolean isLogical(SType type) {
        return SType.BOOLEAN.equals(type) || SType.SIGMA_PROP.equals(type);
    }

    private static Expr toSigmaProp(Expr expr) {
        if (SType.SIGMA_PROP.equals(expr.type())) {
            return expr;
        }
        return new Expr.UnaryOp(OpCode.BOOL_TO_SIGMA_PROP, expr, SType.SIGMA_PROP, expr.source().orElse(null));
    }

    private Expr equality(OpCode code, Expr left, Expr right, Token op) {
        if (SType.isNumeric(left.type()) && SType.isNumeric(right.type())) {
            var type = SType.widest(left.type(), right.type());
            left = widen(left, type, op);
            right = widen(right, type, op);
        } else if (!left.type().equals(right.type())) {
            throw error(op, "Cannot compare " + left.type() + " with " + right.type());
        }
        return new Expr.BinaryOp(code, left, right, SType.BOOLEAN, ctx(op));
    }

    private Expr arithmetic(OpCode code, Expr left, Expr right, Token op) {
        requireNumeric(left, op);
        requireNumeric(right, op);
        var type = SType.widest(left.type(), right.type());
        return new Expr.BinaryOp(code, widen(left, type, op), widen(right, type, op), type, ctx(op));
    }

    private Expr widen(Expr expr, SType target, Token at) {
        if (expr.type().equals(target)) {
            return expr;
        }
        if (SType.numericRank(expr.type()) < SType.numericRank(target)) {
            return upcast(expr, target, expr.source().orElse(ctx(at)));
        }
        throw error(at, "Cannot convert " + expr.type() + " to " + target);
    }

    private static Expr upcast(Expr expr, SType target, SourceContext source) {
        if (expr instanceof Expr.Constant constant) {
            return new Expr.Constant(target, Numerics.convert(constant.value(), target), constant.source().orElse(source));
        }
        return new Expr.UnaryOp(OpCode.UPCAST, expr, target, source);
    }

    private Expr coerce(Expr expr, SType expected, Token at) {
        if (expr.type().equals(expected)) {
            return expr;
        }
        if (SType.isNumeric(expr.type()) && SType.isNumeric(expected)
            && SType.numericRank(expr.type()) < SType.numericRank(expected)) {
            return upcast(expr, expected, expr.source().orElse(ctx(at)));
        }
        throw error(at, "Type mismatch: expected " + expected + ", got " + expr.type());
    }

    private void requireNumeric(Expr expr, Token at) {
        if (!SType.isNumeric(expr.type())) {
            throw error(at, "Operator " + at.lexeme() + " expects numeric operands, got " + expr.type());
        }
    }

    private void requireType(Expr expr, SType expected, Token at) {
        if (!expr.type().equals(expected)) {
            throw error(at, "Type mismatch: expected " + expected + ", got " + expr.type());
        }
    }

    private void declare(Token name, Binding binding) {
        var scope = scopes.peek();
        if (scope.containsKey(name.lexeme())) {
            throw error(name, "'" + name.lexeme() + "' is already defined in this scope");
        }
        scope.put(name.lexeme(), binding);
    }

    private Binding lookup(String name) {
        for (var scope : scopes) {
            var binding = scope.get(name);
            if (binding != null) {
                return binding;
            }
        }
        return null;
    }

    private boolean matchOperator(TokenType type) {
        if (!check(type)) {
            return false;
        }
        if (peek().newlineBefore() && !CONTINUATION_OPERATORS.contains(type)) {
            return false;
        }
        advance();
        return true;
    }

    private void skipSemicolons() {
        while (match(TokenType.SEMICOLON)) {
            // separators only
        }
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        var found = peek();
        throw error(found, message + (found.type() == TokenType.EOF ? " but reached end of input" : " but found '" + found.lexeme() + "'"));
    }

    private Token advance() {
        var token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private SourceContext ctx(Token token) {
        return new SourceContext(token.line(), token.column(), lexer.lineText(token.line()));
    }

    private CompilerException error(Token token, String message) {
        return new CompilerException(message, ctx(token));
    }
}
