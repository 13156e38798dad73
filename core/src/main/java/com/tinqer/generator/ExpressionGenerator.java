package com.tinqer.generator;

import com.tinqer.exception.ErrorContext;
import com.tinqer.exception.SemanticPolicyException;
import com.tinqer.expression.AggregateExpression;
import com.tinqer.expression.AllColumnsExpression;
import com.tinqer.expression.ArithmeticExpression;
import com.tinqer.expression.ArrayExpression;
import com.tinqer.expression.BooleanColumnExpression;
import com.tinqer.expression.BooleanConstantExpression;
import com.tinqer.expression.BooleanExpression;
import com.tinqer.expression.BooleanMethodExpression;
import com.tinqer.expression.BooleanParameterExpression;
import com.tinqer.expression.CaseExpression;
import com.tinqer.expression.CaseInsensitiveFunctionExpression;
import com.tinqer.expression.CoalesceExpression;
import com.tinqer.expression.ColumnExpression;
import com.tinqer.expression.ColumnSource;
import com.tinqer.expression.ComparisonExpression;
import com.tinqer.expression.ComparisonOperator;
import com.tinqer.expression.ConcatExpression;
import com.tinqer.expression.ConstantExpression;
import com.tinqer.expression.ExcludedColumnExpression;
import com.tinqer.expression.Expression;
import com.tinqer.expression.InExpression;
import com.tinqer.expression.IsNullExpression;
import com.tinqer.expression.LogicalExpression;
import com.tinqer.expression.LogicalOperator;
import com.tinqer.expression.NotExpression;
import com.tinqer.expression.ObjectExpression;
import com.tinqer.expression.ParameterExpression;
import com.tinqer.expression.ReferenceExpression;
import com.tinqer.expression.StringMethodExpression;
import com.tinqer.expression.ValueExpression;
import com.tinqer.expression.WindowFunctionExpression;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.tinqer.generator.SQLQuoting.quoteColumn;
import static com.tinqer.generator.SQLQuoting.quoteIdentifier;

/**
 * Renders expression IR as SQL fragments.
 *
 * <p>Literals never appear inline: constants other than {@code NULL} were
 * turned into parameters while parsing, and parameters render through the
 * dialect's placeholder syntax. Array parameters used with {@code IN} expand
 * to one placeholder per element ({@code ids_0, ids_1, ...}), matching the
 * expanded parameter map the dialects bind.
 */
final class ExpressionGenerator {

    private final GenerationContext ctx;

    ExpressionGenerator(GenerationContext ctx) {
        this.ctx = ctx;
    }

    // ==================== Dispatch ====================

    String expression(Expression expr) {
        if (expr instanceof BooleanExpression) {
            return bool((BooleanExpression) expr);
        }
        if (expr instanceof ValueExpression) {
            return value((ValueExpression) expr);
        }
        if (expr instanceof ObjectExpression) {
            throw unsupported("Object expressions can only be used as a projection");
        }
        throw unsupported("Array expressions can only be used as an IN list");
    }

    String bool(BooleanExpression expr) {
        if (expr instanceof ComparisonExpression) {
            return comparison((ComparisonExpression) expr);
        } else if (expr instanceof LogicalExpression) {
            LogicalExpression logical = (LogicalExpression) expr;
            String operator = logical.operator() == LogicalOperator.AND ? "AND" : "OR";
            return "(" + bool(logical.left()) + " " + operator + " " + bool(logical.right()) + ")";
        } else if (expr instanceof NotExpression) {
            return not((NotExpression) expr);
        } else if (expr instanceof BooleanColumnExpression) {
            return column(((BooleanColumnExpression) expr).column());
        } else if (expr instanceof BooleanConstantExpression) {
            return ((BooleanConstantExpression) expr).value() ? "TRUE" : "FALSE";
        } else if (expr instanceof BooleanParameterExpression) {
            return parameter(((BooleanParameterExpression) expr).parameter());
        } else if (expr instanceof BooleanMethodExpression) {
            return booleanMethod((BooleanMethodExpression) expr);
        } else if (expr instanceof CaseInsensitiveFunctionExpression) {
            return caseInsensitive((CaseInsensitiveFunctionExpression) expr);
        } else if (expr instanceof InExpression) {
            return in((InExpression) expr, false);
        } else if (expr instanceof IsNullExpression) {
            IsNullExpression isNull = (IsNullExpression) expr;
            return value(isNull.expression()) + (isNull.negated() ? " IS NOT NULL" : " IS NULL");
        }
        throw unsupported("Unsupported boolean expression: " + expr.getClass().getSimpleName());
    }

    String value(ValueExpression expr) {
        if (expr instanceof ColumnExpression) {
            return column((ColumnExpression) expr);
        } else if (expr instanceof ParameterExpression) {
            return parameter((ParameterExpression) expr);
        } else if (expr instanceof ConstantExpression) {
            ConstantExpression constant = (ConstantExpression) expr;
            if (!constant.isNull()) {
                throw unsupported("Inline constant " + constant.value() + " must be parameterized");
            }
            return "NULL";
        } else if (expr instanceof ExcludedColumnExpression) {
            return "excluded." + quoteIdentifier(((ExcludedColumnExpression) expr).name());
        } else if (expr instanceof ArithmeticExpression) {
            ArithmeticExpression arithmetic = (ArithmeticExpression) expr;
            return "(" + value(arithmetic.left()) + " " + arithmetic.operator().symbol() + " "
                + value(arithmetic.right()) + ")";
        } else if (expr instanceof ConcatExpression) {
            ConcatExpression concat = (ConcatExpression) expr;
            return "(" + value(concat.left()) + " || " + value(concat.right()) + ")";
        } else if (expr instanceof StringMethodExpression) {
            StringMethodExpression method = (StringMethodExpression) expr;
            return method.method().sqlFunction() + "(" + value(method.object()) + ")";
        } else if (expr instanceof AggregateExpression) {
            AggregateExpression aggregate = (AggregateExpression) expr;
            if (aggregate.expression() == null) {
                return aggregate.function().name() + "(*)";
            }
            return aggregate.function().name() + "(" + value(aggregate.expression()) + ")";
        } else if (expr instanceof WindowFunctionExpression) {
            return window((WindowFunctionExpression) expr);
        } else if (expr instanceof CoalesceExpression) {
            List<String> parts = new ArrayList<>();
            for (Expression e : ((CoalesceExpression) expr).expressions()) {
                parts.add(expression(e));
            }
            return "COALESCE(" + String.join(", ", parts) + ")";
        } else if (expr instanceof CaseExpression) {
            return caseWhen((CaseExpression) expr);
        } else if (expr instanceof ReferenceExpression) {
            return reference((ReferenceExpression) expr);
        } else if (expr instanceof AllColumnsExpression) {
            return "*";
        }
        throw unsupported("Unsupported value expression: " + expr.getClass().getSimpleName());
    }

    // ==================== Projections ====================

    /**
     * Renders a projection list. Object properties become {@code expr AS "key"};
     * a boolean property is wrapped in {@code CASE WHEN} so it yields a value.
     */
    String projection(Expression selector) {
        if (selector instanceof ObjectExpression) {
            List<String> parts = new ArrayList<>();
            for (Map.Entry<String, Expression> property : ((ObjectExpression) selector).properties().entrySet()) {
                if (property.getKey().startsWith(ObjectExpression.SPREAD_KEY)) {
                    parts.add(expression(property.getValue()));
                    continue;
                }
                if (property.getValue() instanceof ObjectExpression) {
                    throw unsupported("Nested object in projection is not supported: " + property.getKey());
                }
                parts.add(projectedValue(property.getValue()) + " AS " + quoteIdentifier(property.getKey()));
            }
            return String.join(", ", parts);
        }
        return projectedValue(selector);
    }

    private String projectedValue(Expression expr) {
        if (expr instanceof BooleanExpression
            && !(expr instanceof BooleanColumnExpression)
            && !(expr instanceof BooleanConstantExpression)
            && !(expr instanceof BooleanParameterExpression)) {
            return "CASE WHEN " + bool((BooleanExpression) expr) + " THEN TRUE ELSE FALSE END";
        }
        return expression(expr);
    }

    // ==================== Columns and parameters ====================

    String column(ColumnExpression column) {
        ColumnSource source = column.source();
        if (source instanceof ColumnSource.JoinParam) {
            return quoteColumn(ctx.tableAlias(((ColumnSource.JoinParam) source).paramIndex()), column.name());
        } else if (source instanceof ColumnSource.JoinResult) {
            return quoteColumn(ctx.tableAlias(((ColumnSource.JoinResult) source).tableIndex()), column.name());
        } else if (source instanceof ColumnSource.Spread) {
            return quoteColumn(ctx.tableAlias(((ColumnSource.Spread) source).sourceIndex()), column.name());
        } else if (source instanceof ColumnSource.TableAlias) {
            return quoteColumn(((ColumnSource.TableAlias) source).alias(), column.name());
        }
        if (column.table() != null) {
            return quoteColumn(column.table(), column.name());
        }
        return quoteColumn(ctx.directAlias(), column.name());
    }

    private String reference(ReferenceExpression reference) {
        ColumnSource source = reference.source();
        String alias = null;
        if (source instanceof ColumnSource.JoinParam) {
            alias = ctx.tableAlias(((ColumnSource.JoinParam) source).paramIndex());
        } else if (source instanceof ColumnSource.JoinResult) {
            alias = ctx.tableAlias(((ColumnSource.JoinResult) source).tableIndex());
        } else if (source instanceof ColumnSource.Spread) {
            alias = ctx.tableAlias(((ColumnSource.Spread) source).sourceIndex());
        } else if (source instanceof ColumnSource.TableAlias) {
            alias = ((ColumnSource.TableAlias) source).alias();
        } else if (reference.table() != null) {
            alias = reference.table();
        } else {
            alias = ctx.directAlias();
        }
        return alias == null ? "*" : quoteIdentifier(alias) + ".*";
    }

    /**
     * Indexed access such as {@code p.ids[0]} reads the element the dialect
     * expanded into {@code ids_0}.
     */
    String parameter(ParameterExpression param) {
        if (param.index() != null) {
            return ctx.placeholder(param.bindingName() + "_" + param.index());
        }
        return ctx.placeholder(param.bindingName());
    }

    // ==================== Predicates ====================

    private String comparison(ComparisonExpression comparison) {
        ComparisonOperator operator = comparison.operator();
        boolean nullAware = operator == ComparisonOperator.EQUAL || operator == ComparisonOperator.NOT_EQUAL;
        if (nullAware && isNullConstant(comparison.right())) {
            return value(comparison.left()) + nullTest(operator);
        }
        if (nullAware && isNullConstant(comparison.left())) {
            return value(comparison.right()) + nullTest(operator);
        }
        return value(comparison.left()) + " " + operator.sql() + " " + value(comparison.right());
    }

    private static boolean isNullConstant(ValueExpression expr) {
        return expr instanceof ConstantExpression && ((ConstantExpression) expr).isNull();
    }

    private static String nullTest(ComparisonOperator operator) {
        return operator == ComparisonOperator.EQUAL ? " IS NULL" : " IS NOT NULL";
    }

    private String not(NotExpression not) {
        if (not.expression() instanceof InExpression) {
            return in((InExpression) not.expression(), true);
        }
        String operand = bool(not.expression());
        if (!operand.contains(" ") && !operand.contains("(")) {
            return "NOT " + operand;
        }
        return "NOT (" + operand + ")";
    }

    private String in(InExpression in, boolean negated) {
        List<String> placeholders = new ArrayList<>();
        if (in.list() instanceof ParameterExpression) {
            ParameterExpression param = (ParameterExpression) in.list();
            String name = param.bindingName();
            int size = arraySize(name, ctx.params().get(name), ctx.params().containsKey(name));
            for (int i = 0; i < size; i++) {
                placeholders.add(ctx.placeholder(name + "_" + i));
            }
        } else {
            for (Expression element : ((ArrayExpression) in.list()).elements()) {
                placeholders.add(expression(element));
            }
        }
        if (placeholders.isEmpty()) {
            // x IN () is always false, x NOT IN () always true
            return negated ? "TRUE" : "FALSE";
        }
        return value(in.value()) + (negated ? " NOT IN (" : " IN (") + String.join(", ", placeholders) + ")";
    }

    private static int arraySize(String name, Object value, boolean present) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value != null && value.getClass().isArray()) {
            return Array.getLength(value);
        }
        String found = !present ? "undefined" : value == null ? "null" : value.getClass().getSimpleName();
        throw new SemanticPolicyException("Expected array parameter '" + name + "' but got " + found,
            ErrorContext.method("in"));
    }

    private String booleanMethod(BooleanMethodExpression method) {
        String object = value(method.object());
        String argument = value(method.argument());
        switch (method.method()) {
            case STARTS_WITH:
                return object + " LIKE " + argument + " || '%'";
            case ENDS_WITH:
                return object + " LIKE '%' || " + argument;
            case INCLUDES:
            case CONTAINS:
                return object + " LIKE '%' || " + argument + " || '%'";
            default:
                throw unsupported("Unsupported string test: " + method.method());
        }
    }

    private String caseInsensitive(CaseInsensitiveFunctionExpression function) {
        String left = "LOWER(" + value(function.left()) + ")";
        String right = "LOWER(" + value(function.right()) + ")";
        switch (function.function()) {
            case IEQUALS:
                return left + " = " + right;
            case ISTARTS_WITH:
                return left + " LIKE " + right + " || '%'";
            case IENDS_WITH:
                return left + " LIKE '%' || " + right;
            case ICONTAINS:
                return left + " LIKE '%' || " + right + " || '%'";
            default:
                throw unsupported("Unsupported case-insensitive function: " + function.function());
        }
    }

    // ==================== Compound values ====================

    private String window(WindowFunctionExpression window) {
        List<String> over = new ArrayList<>();
        if (!window.partitionBy().isEmpty()) {
            List<String> partitions = new ArrayList<>();
            for (ValueExpression partition : window.partitionBy()) {
                partitions.add(value(partition));
            }
            over.add("PARTITION BY " + String.join(", ", partitions));
        }
        if (!window.orderBy().isEmpty()) {
            List<String> orders = new ArrayList<>();
            for (WindowFunctionExpression.WindowOrder order : window.orderBy()) {
                orders.add(value(order.expression()) + (order.descending() ? " DESC" : " ASC"));
            }
            over.add("ORDER BY " + String.join(", ", orders));
        }
        return window.function().sql() + "() OVER (" + String.join(" ", over) + ")";
    }

    private String caseWhen(CaseExpression caseExpr) {
        StringBuilder sql = new StringBuilder("CASE");
        for (CaseExpression.WhenClause clause : caseExpr.conditions()) {
            sql.append(" WHEN ").append(bool(clause.when()))
               .append(" THEN ").append(expression(clause.then()));
        }
        if (caseExpr.elseResult() != null) {
            sql.append(" ELSE ").append(expression(caseExpr.elseResult()));
        }
        return sql.append(" END").toString();
    }

    private static SemanticPolicyException unsupported(String message) {
        return new SemanticPolicyException(message, ErrorContext.method("generate"));
    }
}
