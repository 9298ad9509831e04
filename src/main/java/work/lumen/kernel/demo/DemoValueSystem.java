package work.lumen.kernel.demo;

import java.util.List;
import java.util.Optional;
import work.lumen.kernel.error.ArithmeticFaultException;
import work.lumen.kernel.error.RuntimeTypeException;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.runtime.Value;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Numbers (doubles), strings, booleans, {@code none} and ranges ({@code a..b}). Only booleans and
 * {@code none} can be used as conditions; only ranges can be iterated.
 */
public final class DemoValueSystem implements ValueSystem {
    @Override
    public Value unit() {
        return NoneValue.INSTANCE;
    }

    @Override
    public Optional<Value> literal(Token token) {
        var lexeme = token.lexeme();
        if (token.role() == LexemeRole.NUMBER) {
            return Optional.of(new NumberValue(Double.parseDouble(lexeme)));
        }
        if (token.role() == LexemeRole.STRING) {
            return Optional.of(new TextValue(unescape(lexeme.substring(1, lexeme.length() - 1))));
        }
        if (token.role() == LexemeRole.KEYWORD) {
            return switch (lexeme) {
                case "true" -> Optional.of(BoolValue.TRUE);
                case "false" -> Optional.of(BoolValue.FALSE);
                case "none" -> Optional.of(NoneValue.INSTANCE);
                default -> Optional.empty();
            };
        }
        return Optional.empty();
    }

    @Override
    public Value apply(String operator, List<Value> operands) {
        if (operands.size() == 1) {
            return unary(operator, operands.get(0));
        }
        if (operands.size() != 2) {
            throw new RuntimeTypeException("Operator '" + operator + "' takes one or two operands, got " + operands.size());
        }
        var left = operands.get(0);
        var right = operands.get(1);
        return switch (operator) {
            case "+" -> plus(left, right);
            case "-" -> new NumberValue(number(left, operator) - number(right, operator));
            case "*" -> new NumberValue(number(left, operator) * number(right, operator));
            case "/" -> new NumberValue(number(left, operator) / divisor(right, operator));
            case "%" -> new NumberValue(number(left, operator) % divisor(right, operator));
            case "^" -> new NumberValue(Math.pow(number(left, operator), number(right, operator)));
            case "==" -> BoolValue.of(left.sameAs(right));
            case "!=" -> BoolValue.of(!left.sameAs(right));
            case "<" -> BoolValue.of(compare(left, right, operator) < 0);
            case ">" -> BoolValue.of(compare(left, right, operator) > 0);
            case "<=" -> BoolValue.of(compare(left, right, operator) <= 0);
            case ">=" -> BoolValue.of(compare(left, right, operator) >= 0);
            case ".." -> new RangeValue(whole(left, operator), whole(right, operator));
            case "and", "&&" -> BoolValue.of(left.truthy() && right.truthy());
            case "or", "||" -> BoolValue.of(left.truthy() || right.truthy());
            default -> throw new RuntimeTypeException("Unsupported operator '" + operator + "'");
        };
    }

    private static Value unary(String operator, Value operand) {
        return switch (operator) {
            case "-" -> new NumberValue(-number(operand, operator));
            case "not", "!" -> BoolValue.of(!operand.truthy());
            default -> throw new RuntimeTypeException("Unsupported prefix operator '" + operator + "'");
        };
    }

    private static Value plus(Value left, Value right) {
        if (left instanceof TextValue || right instanceof TextValue) {
            return new TextValue(left.display() + right.display());
        }
        return new NumberValue(number(left, "+") + number(right, "+"));
    }

    private static double number(Value value, String operator) {
        return value.downcast(NumberValue.class, operator).value();
    }

    private static long whole(Value value, String operator) {
        double number = number(value, operator);
        if (number != Math.rint(number) || Double.isInfinite(number)) {
            throw new RuntimeTypeException("Operator '" + operator + "' expects whole numbers but got " + value.display());
        }
        return (long) number;
    }

    private static double divisor(Value value, String operator) {
        double divisor = number(value, operator);
        if (divisor == 0) {
            throw new ArithmeticFaultException("Division by zero");
        }
        return divisor;
    }

    private static int compare(Value left, Value right, String operator) {
        if (left instanceof TextValue a && right instanceof TextValue b) {
            return a.value().compareTo(b.value());
        }
        return Double.compare(number(left, operator), number(right, operator));
    }

    static String unescape(String raw) {
        var out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                out.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                default -> out.append(next);
            }
        }
        return out.toString();
    }
}
