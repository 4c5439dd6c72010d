package com.cellblock.remote.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Tree-walking interpreter for cell code.
 *
 * <p>Runs against a caller-owned binding map, which it mutates. The value of the last
 * expression statement becomes the result. {@link ScriptException} signals an evaluation
 * error, {@link WorkerExit} an abnormal end of the worker.
 */
public class Interpreter implements Expr.Visitor<Object>, Stmt.Visitor<Object> {

    private final Map<String, Object> bindings;
    private final SignalBoard signals;
    private final StringBuilder output = new StringBuilder();
    private Object result;
    private boolean hasResult;

    public Interpreter(Map<String, Object> bindings, SignalBoard signals) {
        this.bindings = bindings;
        this.signals = signals;
    }

    public Result run(String code) {
        for (Stmt stmt : Parser.parse(code)) {
            stmt.accept(this);
        }
        return new Result(output.toString(), hasResult, result);
    }

    public String printed() {
        return output.toString();
    }

    /**
     * Printed output plus the final value, when the last statement was an expression.
     */
    public record Result(String printed, boolean hasValue, Object value) {

        public String rendered() {
            return hasValue ? printed + Values.render(value) : printed;
        }
    }

    @Override
    public Object visitAssign(Stmt.Assign stmt) {
        Object value = stmt.value().accept(this);
        bindings.put(stmt.name().lexeme(), value);
        hasResult = false;
        result = null;
        return value;
    }

    @Override
    public Object visitExpression(Stmt.Expression stmt) {
        result = stmt.expression().accept(this);
        hasResult = true;
        return result;
    }

    @Override
    public Object visitLiteral(Expr.Literal expr) {
        return expr.value();
    }

    @Override
    public Object visitVariable(Expr.Variable expr) {
        String name = expr.name().lexeme();
        if (!bindings.containsKey(name)) {
            throw new ScriptException("undefined name '" + name + "'", expr.name().line());
        }
        return bindings.get(name);
    }

    @Override
    public Object visitGrouping(Expr.Grouping expr) {
        return expr.expression().accept(this);
    }

    @Override
    public Object visitUnary(Expr.Unary expr) {
        Object right = expr.right().accept(this);
        if (right instanceof Long n) {
            if (n == Long.MIN_VALUE) {
                throw new ScriptException("integer overflow", expr.operator().line());
            }
            return -n;
        }
        throw new ScriptException("cannot negate " + Values.typeName(right), expr.operator().line());
    }

    @Override
    public Object visitBinary(Expr.Binary expr) {
        Object left = expr.left().accept(this);
        Object right = expr.right().accept(this);
        Token op = expr.operator();
        try {
            return switch (op.type()) {
                case PLUS -> plus(left, right, op);
                case MINUS -> Math.subtractExact(number(left, op), number(right, op));
                case STAR -> Math.multiplyExact(number(left, op), number(right, op));
                case SLASH -> {
                    long divisor = number(right, op);
                    if (divisor == 0) {
                        throw new ScriptException("division by zero", op.line());
                    }
                    yield number(left, op) / divisor;
                }
                case EQUAL_EQUAL -> Objects.equals(left, right);
                case BANG_EQUAL -> !Objects.equals(left, right);
                case LESS -> compare(left, right, op) < 0;
                case GREATER -> compare(left, right, op) > 0;
                default -> throw new ScriptException("unknown operator " + op.lexeme(), op.line());
            };
        } catch (ArithmeticException e) {
            throw new ScriptException("integer overflow", op.line());
        }
    }

    private Object plus(Object left, Object right, Token op) {
        if (left instanceof Long a && right instanceof Long b) {
            return Math.addExact(a, b);
        }
        if (left instanceof String || right instanceof String) {
            return Values.text(left) + Values.text(right);
        }
        if (left instanceof List<?> a && right instanceof List<?> b) {
            var joined = new ArrayList<Object>(a);
            joined.addAll(b);
            return joined;
        }
        throw new ScriptException("cannot add " + Values.typeName(left) + " and " + Values.typeName(right), op.line());
    }

    private static long number(Object value, Token op) {
        if (value instanceof Long n) {
            return n;
        }
        throw new ScriptException("expected int for '" + op.lexeme() + "', got " + Values.typeName(value), op.line());
    }

    private static int compare(Object left, Object right, Token op) {
        if (left instanceof Long a && right instanceof Long b) {
            return Long.compare(a, b);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        throw new ScriptException("cannot compare " + Values.typeName(left) + " and " + Values.typeName(right), op.line());
    }

    @Override
    public Object visitIndex(Expr.Index expr) {
        Object target = expr.target().accept(this);
        Object index = expr.index().accept(this);
        int line = expr.bracket().line();
        if (target instanceof Map<?, ?> map) {
            return map.get(index);
        }
        if (target instanceof List<?> list) {
            return list.get(position(index, list.size(), line));
        }
        if (target instanceof String s) {
            int at = position(index, s.length(), line);
            return s.substring(at, at + 1);
        }
        throw new ScriptException("cannot index " + Values.typeName(target), line);
    }

    private static int position(Object index, int size, int line) {
        if (!(index instanceof Long n)) {
            throw new ScriptException("index must be int, got " + Values.typeName(index), line);
        }
        if (n < 0 || n >= size) {
            throw new ScriptException("index " + n + " out of bounds for length " + size, line);
        }
        return n.intValue();
    }

    @Override
    public Object visitListLiteral(Expr.ListLiteral expr) {
        var list = new ArrayList<Object>();
        for (Expr element : expr.elements()) {
            list.add(element.accept(this));
        }
        return list;
    }

    @Override
    public Object visitMapLiteral(Expr.MapLiteral expr) {
        var map = new LinkedHashMap<Object, Object>();
        for (int i = 0; i < expr.keys().size(); i++) {
            map.put(expr.keys().get(i).accept(this), expr.values().get(i).accept(this));
        }
        return map;
    }

    @Override
    public Object visitCall(Expr.Call expr) {
        String name = expr.callee().lexeme();
        int line = expr.callee().line();
        var args = new ArrayList<Object>();
        for (Expr argument : expr.arguments()) {
            args.add(argument.accept(this));
        }
        return switch (name) {
            case "len" -> length(arg(args, 1, name, line).get(0), line);
            case "str" -> Values.text(arg(args, 1, name, line).get(0));
            case "type" -> Values.typeName(arg(args, 1, name, line).get(0));
            case "print" -> {
                var joiner = new StringJoiner(" ");
                args.forEach(a -> joiner.add(Values.text(a)));
                output.append(joiner).append('\n');
                yield null;
            }
            case "append" -> {
                arg(args, 2, name, line);
                yield append(args.get(0), args.get(1), line);
            }
            case "put" -> {
                arg(args, 3, name, line);
                yield put(args.get(0), args.get(1), args.get(2), line);
            }
            case "sleep" -> {
                long millis = number(arg(args, 1, name, line).get(0), expr.callee());
                try {
                    Thread.sleep(Math.max(0, millis));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WorkerExit("interrupted while sleeping", e);
                }
                yield null;
            }
            case "await" -> {
                String gate = Values.text(arg(args, 1, name, line).get(0));
                try {
                    signals.await(gate);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new WorkerExit("interrupted while awaiting " + gate, e);
                }
                yield null;
            }
            case "signal" -> {
                signals.signal(Values.text(arg(args, 1, name, line).get(0)));
                yield null;
            }
            case "raise" -> throw new ScriptException(Values.text(arg(args, 1, name, line).get(0)), line);
            case "exit" -> throw new WorkerExit(Values.text(arg(args, 1, name, line).get(0)));
            default -> throw new ScriptException("unknown function '" + name + "'", line);
        };
    }

    private static List<Object> arg(List<Object> args, int expected, String name, int line) {
        if (args.size() != expected) {
            throw new ScriptException(Builtins.ALL.get(name).signature() + " takes " + expected
                    + " argument" + (expected == 1 ? "" : "s") + ", got " + args.size(), line);
        }
        return args;
    }

    private static long length(Object value, int line) {
        if (value instanceof String s) return s.length();
        if (value instanceof List<?> l) return l.size();
        if (value instanceof Map<?, ?> m) return m.size();
        throw new ScriptException("len of " + Values.typeName(value), line);
    }

    @SuppressWarnings("unchecked")
    private static Object append(Object target, Object value, int line) {
        if (!(target instanceof List<?> list)) {
            throw new ScriptException("append expects a list, got " + Values.typeName(target), line);
        }
        ((List<Object>) list).add(value);
        return list;
    }

    @SuppressWarnings("unchecked")
    private static Object put(Object target, Object key, Object value, int line) {
        if (!(target instanceof Map<?, ?> map)) {
            throw new ScriptException("put expects a map, got " + Values.typeName(target), line);
        }
        ((Map<Object, Object>) map).put(key, value);
        return map;
    }
}
