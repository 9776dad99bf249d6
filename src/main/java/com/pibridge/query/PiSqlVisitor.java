package com.pibridge.query;

import com.pibridge.query.parser.PiSqlBaseVisitor;
import com.pibridge.query.parser.PiSqlParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * ANTLR visitor turning a restricted SQL parse tree into a {@link ParsedQuery}.
 *
 * Only {@code timestamp}, {@code value} and {@code tag} predicates are extracted; other columns
 * and negated predicates are accepted by the grammar and ignored here.
 */
public class PiSqlVisitor extends PiSqlBaseVisitor<ParsedQuery> {

    private static final String TIMESTAMP = "timestamp";
    private static final String VALUE = "value";
    private static final String TAG = "tag";

    @Override
    public ParsedQuery visitQuery(PiSqlParser.QueryContext ctx) {
        PiSqlParser.SelectStatementContext select = ctx.selectStatement();
        ParsedQuery parsed = new ParsedQuery();

        // LIMIT wins over TOP when both are written
        if (select.limitClause() != null) {
            parsed.setLimit(parseCount(select.limitClause().NUMBER(), "LIMIT"));
        } else if (select.topClause() != null) {
            parsed.setLimit(parseCount(select.topClause().NUMBER(), "TOP"));
            parsed.setLimitFromTop(true);
        }

        WhereConditions where = new WhereConditions();
        if (select.whereClause() != null) {
            collectPredicates(select.whereClause().expression(), where);
        }
        parsed.setWhere(where);

        if (where.getTagEq() != null) {
            parsed.setTag(where.getTagEq());
        } else if (select.groupByClause() != null && select.groupByClause().expression() != null) {
            WhereConditions having = new WhereConditions();
            collectPredicates(select.groupByClause().expression(), having);
            parsed.setTag(having.getTagEq());
        }

        PiSqlParser.DateSubContext dateSub = findFirst(select, PiSqlParser.DateSubContext.class);
        if (dateSub != null) {
            long amount = parseCount(dateSub.NUMBER(), "INTERVAL");
            parsed.setLegacyTimeRange(LegacyTimeRange.of(amount, dateSub.timeUnit().getText()));
        }

        if (select.orderByClause() != null) {
            parsed.setOrderByColumn(columnName(select.orderByClause().orderItem(0).columnRef()));
        }

        return parsed;
    }

    private void collectPredicates(PiSqlParser.ExpressionContext expression, WhereConditions where) {
        if (expression instanceof PiSqlParser.AndExpressionContext) {
            for (PiSqlParser.ExpressionContext child : ((PiSqlParser.AndExpressionContext) expression).expression()) {
                collectPredicates(child, where);
            }
        } else if (expression instanceof PiSqlParser.OrExpressionContext) {
            for (PiSqlParser.ExpressionContext child : ((PiSqlParser.OrExpressionContext) expression).expression()) {
                collectPredicates(child, where);
            }
        } else if (expression instanceof PiSqlParser.ParenExpressionContext) {
            collectPredicates(((PiSqlParser.ParenExpressionContext) expression).expression(), where);
        } else if (expression instanceof PiSqlParser.PredicateExpressionContext) {
            applyPredicate(((PiSqlParser.PredicateExpressionContext) expression).predicate(), where);
        }
    }

    private void applyPredicate(PiSqlParser.PredicateContext predicate, WhereConditions where) {
        if (predicate instanceof PiSqlParser.ComparisonPredicateContext) {
            applyComparison((PiSqlParser.ComparisonPredicateContext) predicate, where);
        } else if (predicate instanceof PiSqlParser.BetweenPredicateContext) {
            applyBetween((PiSqlParser.BetweenPredicateContext) predicate, where);
        } else if (predicate instanceof PiSqlParser.InPredicateContext) {
            PiSqlParser.InPredicateContext in = (PiSqlParser.InPredicateContext) predicate;
            if (in.NOT() == null && TAG.equals(columnName(in.columnRef())) && where.getTagIn() == null) {
                List<String> tags = new ArrayList<>();
                for (PiSqlParser.OperandContext operand : in.operand()) {
                    tags.add(operandText(operand));
                }
                where.setTagIn(tags);
            }
        } else if (predicate instanceof PiSqlParser.LikePredicateContext) {
            PiSqlParser.LikePredicateContext like = (PiSqlParser.LikePredicateContext) predicate;
            if (like.NOT() == null && TAG.equals(columnName(like.columnRef())) && where.getTagLike() == null) {
                where.setTagLike(unquote(like.STRING().getText()));
            }
        }
    }

    private void applyComparison(PiSqlParser.ComparisonPredicateContext comparison, WhereConditions where) {
        String column = columnName(comparison.columnRef());
        String operator = comparison.comparisonOperator().getText();
        PiSqlParser.OperandContext operand = comparison.operand();

        switch (column) {
            case TIMESTAMP -> {
                if (!(operand instanceof PiSqlParser.StringOperandContext)) {
                    return;
                }
                if (">=".equals(operator) && where.getTimestampGte() == null) {
                    where.setTimestampGte(operandText(operand));
                } else if ("<=".equals(operator) && where.getTimestampLte() == null) {
                    where.setTimestampLte(operandText(operand));
                }
            }
            case VALUE -> {
                Double number = numericOperand(operand);
                if (number == null) {
                    return;
                }
                if (">".equals(operator) && where.getValueGt() == null) {
                    where.setValueGt(number);
                } else if ("<".equals(operator) && where.getValueLt() == null) {
                    where.setValueLt(number);
                }
            }
            case TAG -> {
                boolean textual = operand instanceof PiSqlParser.StringOperandContext
                    || operand instanceof PiSqlParser.IdentifierOperandContext;
                if ("=".equals(operator) && textual && where.getTagEq() == null) {
                    where.setTagEq(operandText(operand));
                }
            }
            default -> {
                // other columns are not pushed down
            }
        }
    }

    private void applyBetween(PiSqlParser.BetweenPredicateContext between, WhereConditions where) {
        if (between.NOT() != null) {
            return;
        }
        String column = columnName(between.columnRef());
        PiSqlParser.OperandContext lower = between.operand(0);
        PiSqlParser.OperandContext upper = between.operand(1);

        if (TIMESTAMP.equals(column) && where.getTimestampBetween() == null
                && lower instanceof PiSqlParser.StringOperandContext
                && upper instanceof PiSqlParser.StringOperandContext) {
            where.setTimestampBetween(new WhereConditions.Bounds<>(operandText(lower), operandText(upper)));
        } else if (VALUE.equals(column) && where.getValueBetween() == null) {
            Double min = numericOperand(lower);
            Double max = numericOperand(upper);
            if (min != null && max != null) {
                where.setValueBetween(new WhereConditions.Bounds<>(min, max));
            }
        }
    }

    private static String columnName(PiSqlParser.ColumnRefContext columnRef) {
        List<TerminalNode> parts = columnRef.IDENTIFIER();
        return parts.get(parts.size() - 1).getText().toLowerCase(Locale.ROOT);
    }

    private static String operandText(PiSqlParser.OperandContext operand) {
        if (operand instanceof PiSqlParser.StringOperandContext) {
            return unquote(((PiSqlParser.StringOperandContext) operand).STRING().getText());
        }
        return operand.getText();
    }

    private static Double numericOperand(PiSqlParser.OperandContext operand) {
        if (!(operand instanceof PiSqlParser.NumberOperandContext)) {
            return null;
        }
        return Double.parseDouble(operand.getText());
    }

    /**
     * Strip the surrounding quotes and collapse doubled quote characters.
     */
    static String unquote(String literal) {
        char quote = literal.charAt(0);
        String body = literal.substring(1, literal.length() - 1);
        String doubled = String.valueOf(quote) + quote;
        return body.replace(doubled, String.valueOf(quote));
    }

    private static int parseCount(TerminalNode number, String clause) {
        String text = number.getText();
        try {
            int count = Integer.parseInt(text);
            if (count <= 0) {
                throw new QueryParseException(clause + " must be a positive whole number, got " + text);
            }
            return count;
        } catch (NumberFormatException e) {
            throw new QueryParseException(clause + " must be a positive whole number, got " + text, null, e);
        }
    }

    private static <T extends ParserRuleContext> T findFirst(ParseTree node, Class<T> type) {
        if (type.isInstance(node)) {
            return type.cast(node);
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            T found = findFirst(node.getChild(i), type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
