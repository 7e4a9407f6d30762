package io.github.drompincen.mockjira.runtime.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the supported query subset:
 * <pre>
 * query  := [clause (AND clause)*] [ORDER BY sort (, sort)*]
 * clause := field = value | field IN (value, ...) | (created|updated) (&gt;=|&gt;|&lt;=|&lt;) date
 * </pre>
 * {@code OR}, {@code NOT} and parenthesised grouping are rejected.
 */
public final class QueryParser {

    private static final Logger log = LoggerFactory.getLogger(QueryParser.class);

    private static final Map<String, String> FIELD_ALIASES = Map.of(
            "type", "issuetype",
            "issuekey", "key",
            "createddate", "created",
            "updateddate", "updated",
            "category", "statuscategory");

    private static final Set<String> DATE_FIELDS = Set.of("created", "updated");

    private final List<QueryToken> tokens;
    private int index;

    private QueryParser(String input) {
        this.tokens = new QueryTokenizer(input).tokenize();
    }

    /**
     * Parses {@code input} strictly.
     *
     * @throws QuerySyntaxException if the input uses unsupported syntax
     */
    public static QueryPlan parse(String input) {
        if (input == null || input.isBlank()) {
            return QueryPlan.EMPTY;
        }
        return new QueryParser(input).query();
    }

    /**
     * Parses {@code input}, falling back to the empty (match everything) plan on any syntax error.
     */
    public static QueryPlan parseLenient(String input) {
        try {
            return parse(input);
        } catch (QuerySyntaxException e) {
            log.debug("Falling back to empty plan for query '{}': {}", input, e.getMessage());
            return QueryPlan.EMPTY;
        }
    }

    /**
     * Canonical, lower-case field name.
     */
    public static String canonicalField(String field) {
        String lower = field.trim().toLowerCase(Locale.ROOT);
        return FIELD_ALIASES.getOrDefault(lower, lower);
    }

    private QueryPlan query() {
        List<EqualityFilter> equality = new ArrayList<>();
        List<SetFilter> sets = new ArrayList<>();
        List<DateFilter> dates = new ArrayList<>();
        List<SortKey> sortKeys = new ArrayList<>();

        if (!peek().isKeyword("ORDER") && peek().type() != QueryToken.Type.EOF) {
            clause(equality, sets, dates);
            while (peek().isKeyword("AND")) {
                next();
                clause(equality, sets, dates);
            }
        }
        if (peek().isKeyword("ORDER")) {
            next();
            expectKeyword("BY");
            sortKeys.add(sortKey());
            while (peek().type() == QueryToken.Type.COMMA) {
                next();
                sortKeys.add(sortKey());
            }
        }
        QueryToken trailing = peek();
        if (trailing.isKeyword("OR")) {
            throw new QuerySyntaxException("OR is not supported", trailing.position());
        }
        if (trailing.type() != QueryToken.Type.EOF) {
            throw new QuerySyntaxException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return new QueryPlan(equality, sets, dates, sortKeys);
    }

    private void clause(List<EqualityFilter> equality, List<SetFilter> sets, List<DateFilter> dates) {
        QueryToken fieldToken = next();
        if (fieldToken.type() == QueryToken.Type.LPAREN) {
            throw new QuerySyntaxException("Parenthesised grouping is not supported", fieldToken.position());
        }
        if (fieldToken.isKeyword("NOT") || fieldToken.isKeyword("OR")) {
            throw new QuerySyntaxException(fieldToken.text().toUpperCase(Locale.ROOT) + " is not supported",
                    fieldToken.position());
        }
        if (fieldToken.type() != QueryToken.Type.WORD && fieldToken.type() != QueryToken.Type.STRING) {
            throw new QuerySyntaxException("Expected a field name", fieldToken.position());
        }
        String field = canonicalField(fieldToken.text());

        QueryToken op = next();
        if (op.isKeyword("IN")) {
            expect(QueryToken.Type.LPAREN, "(");
            List<QueryValue> values = new ArrayList<>();
            values.add(value());
            while (peek().type() == QueryToken.Type.COMMA) {
                next();
                values.add(value());
            }
            expect(QueryToken.Type.RPAREN, ")");
            sets.add(new SetFilter(field, values));
            return;
        }
        if (op.type() != QueryToken.Type.OPERATOR) {
            throw new QuerySyntaxException("Expected an operator after '" + fieldToken.text() + "'", op.position());
        }
        if (op.text().equals("=")) {
            if (DATE_FIELDS.contains(field)) {
                throw new QuerySyntaxException("Use a range operator to compare " + field, op.position());
            }
            equality.add(new EqualityFilter(field, value()));
            return;
        }
        ComparisonOperator comparison = ComparisonOperator.fromSymbol(op.text())
                .orElseThrow(() -> new QuerySyntaxException("Unsupported operator '" + op.text() + "'",
                        op.position()));
        if (!DATE_FIELDS.contains(field)) {
            throw new QuerySyntaxException("Range comparisons are only supported on created and updated",
                    op.position());
        }
        QueryValue operand = value();
        dates.add(new DateFilter(field, comparison, DateLiteral.parse(operand.text())));
    }

    private QueryValue value() {
        QueryToken token = next();
        if (token.type() == QueryToken.Type.STRING) {
            return QueryValue.literal(token.text());
        }
        if (token.type() != QueryToken.Type.WORD) {
            throw new QuerySyntaxException("Expected a value", token.position());
        }
        if (peek().type() == QueryToken.Type.LPAREN) {
            next();
            expect(QueryToken.Type.RPAREN, ")");
            String function = token.lower();
            if (function.equals("currentuser")) {
                return QueryValue.currentUserPlaceholder();
            }
            if (function.equals("now")) {
                return QueryValue.literal("now()");
            }
            throw new QuerySyntaxException("Unsupported function '" + token.text() + "()'", token.position());
        }
        if (token.isKeyword("AND") || token.isKeyword("OR") || token.isKeyword("ORDER")) {
            throw new QuerySyntaxException("Expected a value", token.position());
        }
        return QueryValue.literal(token.text());
    }

    private SortKey sortKey() {
        QueryToken field = next();
        if (field.type() != QueryToken.Type.WORD && field.type() != QueryToken.Type.STRING) {
            throw new QuerySyntaxException("Expected a sort field", field.position());
        }
        boolean descending = false;
        if (peek().isKeyword("ASC")) {
            next();
        } else if (peek().isKeyword("DESC")) {
            next();
            descending = true;
        }
        return new SortKey(canonicalField(field.text()), descending);
    }

    private QueryToken peek() {
        return tokens.get(index);
    }

    private QueryToken next() {
        QueryToken token = tokens.get(index);
        if (token.type() != QueryToken.Type.EOF) {
            index++;
        }
        return token;
    }

    private void expect(QueryToken.Type type, String text) {
        QueryToken token = next();
        if (token.type() != type) {
            throw new QuerySyntaxException("Expected '" + text + "'", token.position());
        }
    }

    private void expectKeyword(String keyword) {
        QueryToken token = next();
        if (!token.isKeyword(keyword)) {
            throw new QuerySyntaxException("Expected " + keyword, token.position());
        }
    }
}
