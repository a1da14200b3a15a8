package com.oxlang.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.oxlang.debug.Debug;
import com.oxlang.debug.DebugLevel;
import com.oxlang.script.ErrorKind;
import com.oxlang.script.OxError;
import com.oxlang.script.parser.Expr.ArrayLiteral;
import com.oxlang.script.parser.Expr.Binary;
import com.oxlang.script.parser.Expr.Call;
import com.oxlang.script.parser.Expr.ExprInterface;
import com.oxlang.script.parser.Expr.ExprVisitor;
import com.oxlang.script.parser.Expr.GetExpr;
import com.oxlang.script.parser.Expr.IndexExpr;
import com.oxlang.script.parser.Expr.Literal;
import com.oxlang.script.parser.Expr.Logical;
import com.oxlang.script.parser.Expr.MethodCallExpr;
import com.oxlang.script.parser.Expr.Unary;
import com.oxlang.script.parser.Expr.Variable;
import com.oxlang.script.parser.Statement.AssignStmt;
import com.oxlang.script.parser.Statement.Block;
import com.oxlang.script.parser.Statement.BreakStmt;
import com.oxlang.script.parser.Statement.ContinueStmt;
import com.oxlang.script.parser.Statement.ExprStmt;
import com.oxlang.script.parser.Statement.For;
import com.oxlang.script.parser.Statement.ForIn;
import com.oxlang.script.parser.Statement.FunctionStmt;
import com.oxlang.script.parser.Statement.If;
import com.oxlang.script.parser.Statement.ImportStmt;
import com.oxlang.script.parser.Statement.ReturnStmt;
import com.oxlang.script.parser.Statement.Stmt;
import com.oxlang.script.parser.Statement.StmtVisitor;
import com.oxlang.script.parser.Statement.StructStmt;
import com.oxlang.script.parser.Statement.While;
import com.oxlang.script.parser.Value.StructDef;
import com.oxlang.script.parser.Value.StructInstance;

public class Interpreter implements ExprVisitor<Value>, StmtVisitor {
    private static final String TAG = "ox.interp";

    /** Resolves {@code import} statements; implemented by the module registry. */
    public interface ModuleImporter {
        void importModule(String module, Interpreter interpreter);
    }

    Environment env;
    private final Environment globals;
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final ModuleImporter importer;
    private int maxDepth;
    private boolean traceCalls;

    public Interpreter(Environment globals, int maxDepth, boolean traceCalls, ModuleImporter importer) {
        if (globals == null || !globals.isGlobal()) {
            throw new IllegalArgumentException("globals must be a root environment");
        }
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.globals = globals;
        this.env = globals;
        this.maxDepth = maxDepth;
        this.traceCalls = traceCalls;
        this.importer = importer;
    }

    public Environment globals() { return globals; }

    public void setMaxDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = depth;
    }

    public void setTraceCalls(boolean traceCalls) { this.traceCalls = traceCalls; }

    // -------------------------
    // Entry points
    // -------------------------

    /** Runs a program in the global scope; returns the value of its last top-level expression statement. */
    public Value execute(List<Stmt> program) {
        return executeIn(program, globals);
    }

    public Value executeIn(List<Stmt> program, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            Value last = Value.nil();
            for (Stmt stmt : program) {
                if (stmt instanceof ExprStmt) {
                    last = eval(((ExprStmt) stmt).expression);
                } else {
                    exec(stmt);
                }
            }
            return last;
        } catch (StackOverflowError so) {
            throw hostOverflow(so);
        } finally {
            env = previous;
        }
    }

    /** Host-side call of a global function or struct constructor. */
    public Value callGlobal(String name, List<Value> args) {
        Value callee = globals.get(name);
        try {
            return callValue(callee, new ArrayList<>(args), null);
        } catch (StackOverflowError so) {
            throw hostOverflow(so);
        }
    }

    // -------------------------
    // Statements
    // -------------------------

    private void exec(Stmt stmt) {
        stmt.accept(this);
    }

    void executeBlock(List<Stmt> statements, Environment scope) {
        Environment previous = env;
        env = scope;
        try {
            for (Stmt s : statements) exec(s);
        } finally {
            env = previous;
        }
    }

    @Override
    public void visitExprStmt(ExprStmt stmt) { eval(stmt.expression); }

    @Override
    public void visitAssignStmt(AssignStmt stmt) {
        ExprInterface target = stmt.target;
        try {
            if (target instanceof Variable) {
                assignVariable(((Variable) target).name, stmt);
            } else if (target instanceof GetExpr) {
                assignField((GetExpr) target, stmt);
            } else if (target instanceof IndexExpr) {
                assignIndex((IndexExpr) target, stmt);
            } else {
                throw OxError.type(stmt.operator, "Invalid assignment target");
            }
        } catch (OxError e) {
            throw e.locateIfUnknown(stmt.operator);
        }
    }

    private void assignVariable(Token name, AssignStmt stmt) {
        String n = name.lexeme;
        if (!stmt.isCompound()) {
            Value value = eval(stmt.value);
            // Inside a call, a plain '=' never rebinds a global.
            boolean rebind = callStack.isEmpty() ? env.isDefined(n) : env.isDefinedBelowGlobal(n);
            if (rebind) env.set(n, value);
            else env.declare(n, value);
            return;
        }
        if (!env.isDefined(n)) {
            throw OxError.name(name, "Undefined name '" + n + "'");
        }
        Value current = env.get(n);
        Value rhs = eval(stmt.value);
        env.set(n, compound(current, stmt.operator, rhs));
    }

    private void assignField(GetExpr target, AssignStmt stmt) {
        Value receiver = eval(target.receiver);
        String field = target.name.lexeme;
        if (receiver.type != Value.Type.STRUCT_INSTANCE) {
            throw OxError.type(target.name, "Cannot set field '" + field + "' on " + receiver.typeName());
        }
        StructInstance inst = receiver.asInstance();
        if (!inst.fields.containsKey(field)) {
            throw OxError.name(target.name, inst.def.name + " has no field '" + field + "'");
        }
        Value rhs = eval(stmt.value);
        Value result = stmt.isCompound() ? compound(inst.fields.get(field), stmt.operator, rhs) : rhs;
        inst.fields.put(field, result);
    }

    private void assignIndex(IndexExpr target, AssignStmt stmt) {
        Value container = eval(target.target);
        Value idx = eval(target.index);
        if (container.type != Value.Type.ARRAY) {
            throw OxError.type(target.bracket, "Cannot assign by index into " + container.typeName());
        }
        List<Value> items = container.asArray();
        int i = toIndex(idx, target.bracket);
        Value rhs = eval(stmt.value);

        if (stmt.isCompound()) {
            checkBounds(i, items.size(), target.bracket);
            items.set(i, compound(items.get(i), stmt.operator, rhs));
            return;
        }
        if (i == items.size()) {
            items.add(rhs);
            return;
        }
        checkBounds(i, items.size(), target.bracket);
        items.set(i, rhs);
    }

    private Value compound(Value current, Token operator, Value rhs) {
        switch (operator.type) {
            case PLUS_EQUAL:
                if (current.type == Value.Type.ARRAY) {
                    current.asArray().add(rhs);
                    return current;
                }
                return arithmetic(TokenType.PLUS, current, rhs, operator);
            case MINUS_EQUAL: return arithmetic(TokenType.MINUS, current, rhs, operator);
            case STAR_EQUAL: return arithmetic(TokenType.STAR, current, rhs, operator);
            case SLASH_EQUAL: return arithmetic(TokenType.SLASH, current, rhs, operator);
            case CARET_EQUAL: return arithmetic(TokenType.CARET, current, rhs, operator);
            default:
                throw OxError.type(operator, "Unsupported assignment operator '" + operator.lexeme + "'");
        }
    }

    @Override
    public void visitBlockStmt(Block stmt) {
        executeBlock(stmt.statements, env.child());
    }

    @Override
    public void visitIfStmt(If stmt) {
        if (condition(stmt.condition, stmt.keyword)) {
            exec(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            exec(stmt.elseBranch);
        }
    }

    @Override
    public void visitWhileStmt(While stmt) {
        while (condition(stmt.condition, stmt.keyword)) {
            try {
                exec(stmt.body);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // next iteration
            }
        }
    }

    @Override
    public void visitForStmt(For stmt) {
        Environment previous = env;
        env = env.child();
        try {
            exec(stmt.initializer);
            while (condition(stmt.condition, stmt.keyword)) {
                try {
                    exec(stmt.body);
                } catch (BreakSignal bs) {
                    break;
                } catch (ContinueSignal cs) {
                    // fall through to the increment
                }
                exec(stmt.increment);
            }
        } finally {
            env = previous;
        }
    }

    @Override
    public void visitForInStmt(ForIn stmt) {
        Value iterable = eval(stmt.iterable);
        List<Value> items;
        if (iterable.type == Value.Type.ARRAY) {
            items = new ArrayList<>(iterable.asArray());
        } else if (iterable.type == Value.Type.STRING) {
            String s = iterable.asString();
            items = new ArrayList<>(s.length());
            for (int i = 0; i < s.length(); i++) items.add(Value.string(String.valueOf(s.charAt(i))));
        } else {
            throw OxError.type(stmt.keyword, "Cannot iterate over " + iterable.typeName());
        }

        for (Value item : items) {
            Environment scope = env.child();
            scope.declare(stmt.variable.lexeme, item);
            try {
                executeBlock(stmt.body.statements, scope);
            } catch (BreakSignal bs) {
                break;
            } catch (ContinueSignal cs) {
                // next element
            }
        }
    }

    @Override
    public void visitFunctionStmt(FunctionStmt stmt) {
        Closure fn = new Closure(stmt.qualifiedName(), stmt.params, stmt.body, env);
        if (stmt.kind == FunctionStmt.Kind.PLAIN) {
            env.declare(stmt.name.lexeme, Value.function(fn));
            return;
        }

        StructDef def = lookupStruct(stmt.owner);
        if (stmt.kind == FunctionStmt.Kind.STATIC) {
            def.staticMethods.put(stmt.name.lexeme, fn);
        } else {
            def.instanceMethods.put(stmt.name.lexeme, fn);
        }
    }

    private StructDef lookupStruct(Token name) {
        if (!env.isDefined(name.lexeme)) {
            throw OxError.name(name, "Undefined struct '" + name.lexeme + "'");
        }
        Value v = env.get(name.lexeme);
        if (v.type != Value.Type.STRUCT_TYPE) {
            throw OxError.type(name, "'" + name.lexeme + "' is not a struct, got " + v.typeName());
        }
        return v.asStructType();
    }

    @Override
    public void visitStructStmt(StructStmt stmt) {
        StructDef parent = (stmt.parent == null) ? null : lookupStruct(stmt.parent);

        List<String> fields = new ArrayList<>(stmt.fields.size());
        for (Token f : stmt.fields) {
            if (parent != null && parent.hasField(f.lexeme)) {
                throw OxError.name(f, "Field '" + f.lexeme + "' is already declared by " + parent.name);
            }
            fields.add(f.lexeme);
        }

        env.declare(stmt.name.lexeme, Value.structType(new StructDef(stmt.name.lexeme, fields, parent)));
    }

    @Override
    public void visitImportStmt(ImportStmt stmt) {
        if (importer == null) {
            throw OxError.name(stmt.keyword, "No module loader configured for import '" + stmt.module + "'");
        }
        try {
            importer.importModule(stmt.module, this);
        } catch (OxError e) {
            throw e.locateIfUnknown(stmt.keyword);
        }
    }

    @Override
    public void visitReturnStmt(ReturnStmt stmt) {
        throw new ReturnSignal(stmt.value == null ? Value.nil() : eval(stmt.value));
    }

    @Override
    public void visitBreakStmt(BreakStmt stmt) {
        throw new BreakSignal();
    }

    @Override
    public void visitContinueStmt(ContinueStmt stmt) {
        throw new ContinueSignal();
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Value eval(ExprInterface expr) {
        return expr.accept(this);
    }

    private boolean condition(ExprInterface expr, Token keyword) {
        Value v = eval(expr);
        if (v.type != Value.Type.BOOL) {
            throw OxError.type(keyword, "Condition of '" + keyword.lexeme + "' must be a bool, got " + v.typeName());
        }
        return v.asBool();
    }

    @Override
    public Value visitLiteralExpr(Literal expr) {
        Object v = expr.value;
        if (v == null) return Value.nil();
        if (v instanceof Double) return Value.number((Double) v);
        if (v instanceof Boolean) return Value.bool((Boolean) v);
        if (v instanceof String) return Value.string((String) v);
        throw OxError.type(expr.token, "Unsupported literal: " + v);
    }

    @Override
    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> out = new ArrayList<>(expr.items.size());
        for (ExprInterface item : expr.items) out.add(eval(item));
        return Value.array(out);
    }

    @Override
    public Value visitVariableExpr(Variable expr) {
        String n = expr.name.lexeme;
        if (!env.isDefined(n)) {
            throw OxError.name(expr.name, "Undefined name '" + n + "'");
        }
        return env.get(n);
    }

    @Override
    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS:
            case MINUS:
            case STAR:
            case SLASH:
            case CARET:
                return arithmetic(op.type, left, right, op);

            case EQUAL_EQUAL:
                return Value.bool(isEqual(left, right, op));
            case BANG_EQUAL:
                return Value.bool(!isEqual(left, right, op));

            case GREATER:
            case GREATER_EQUAL:
            case LESS:
            case LESS_EQUAL:
                return Value.bool(relational(left, right, op));

            default:
                throw OxError.type(op, "Unsupported binary operator '" + op.lexeme + "'");
        }
    }

    private Value arithmetic(TokenType op, Value left, Value right, Token at) {
        if (op == TokenType.PLUS && left.type == Value.Type.STRING && right.type == Value.Type.STRING) {
            return Value.string(left.asString() + right.asString());
        }
        if (left.type != Value.Type.NUMBER || right.type != Value.Type.NUMBER) {
            String expected = (op == TokenType.PLUS) ? "two numbers or two strings" : "numbers";
            throw OxError.type(at, "Operands of '" + symbol(op) + "' must be " + expected
                    + ", got " + left.typeName() + " and " + right.typeName());
        }
        double a = left.asNumber();
        double b = right.asNumber();
        switch (op) {
            case PLUS: return Value.number(a + b);
            case MINUS: return Value.number(a - b);
            case STAR: return Value.number(a * b);
            case SLASH: return Value.number(a / b);
            case CARET: return Value.number(Math.pow(a, b));
            default:
                throw OxError.type(at, "Unsupported arithmetic operator '" + symbol(op) + "'");
        }
    }

    private static String symbol(TokenType op) {
        switch (op) {
            case PLUS: return "+";
            case MINUS: return "-";
            case STAR: return "*";
            case SLASH: return "/";
            case CARET: return "^";
            default: return op.name();
        }
    }

    private boolean isEqual(Value a, Value b, Token op) {
        // nil compares with anything and equals only nil
        if (a.type == Value.Type.NIL || b.type == Value.Type.NIL) return a.type == b.type;
        if (a.type != b.type) {
            throw OxError.type(op, "Cannot compare " + a.typeName() + " with " + b.typeName());
        }
        return sameValue(a, b);
    }

    /** Structural equality for numbers, strings, bools and arrays; identity for the rest. */
    public static boolean sameValue(Value a, Value b) {
        return sameValue(a, b, new ArrayList<List<Value>[]>());
    }

    // open holds the array pairs already being compared; meeting one again means they agree so far
    private static boolean sameValue(Value a, Value b, List<List<Value>[]> open) {
        if (a.type != b.type) return false;
        switch (a.type) {
            case NIL: return true;
            case NUMBER: return a.asNumber() == b.asNumber();
            case BOOL: return a.asBool() == b.asBool();
            case STRING: return a.asString().equals(b.asString());
            case ARRAY: {
                List<Value> x = a.asArray();
                List<Value> y = b.asArray();
                if (x == y) return true;
                if (x.size() != y.size()) return false;
                for (List<Value>[] pair : open) {
                    if (pair[0] == x && pair[1] == y) return true;
                }
                @SuppressWarnings("unchecked")
                List<Value>[] pair = new List[] { x, y };
                open.add(pair);
                try {
                    for (int i = 0; i < x.size(); i++) {
                        if (!sameValue(x.get(i), y.get(i), open)) return false;
                    }
                    return true;
                } finally {
                    open.remove(open.size() - 1);
                }
            }
            default:
                return a.value == b.value;
        }
    }

    private boolean relational(Value a, Value b, Token op) {
        int c;
        if (a.type == Value.Type.NUMBER && b.type == Value.Type.NUMBER) {
            double x = a.asNumber();
            double y = b.asNumber();
            switch (op.type) {
                case GREATER: return x > y;
                case GREATER_EQUAL: return x >= y;
                case LESS: return x < y;
                default: return x <= y;
            }
        } else if (a.type == Value.Type.STRING && b.type == Value.Type.STRING) {
            c = a.asString().compareTo(b.asString());
        } else {
            throw OxError.type(op, "Operands of '" + op.lexeme + "' must be two numbers or two strings, got "
                    + a.typeName() + " and " + b.typeName());
        }
        switch (op.type) {
            case GREATER: return c > 0;
            case GREATER_EQUAL: return c >= 0;
            case LESS: return c < 0;
            default: return c <= 0;
        }
    }

    @Override
    public Value visitLogicalExpr(Logical expr) {
        Value left = eval(expr.left);
        boolean l = requireBool(left, expr.operator);
        if (expr.operator.type == TokenType.OR_OR) {
            if (l) return left;
        } else {
            if (!l) return left;
        }
        Value right = eval(expr.right);
        requireBool(right, expr.operator);
        return right;
    }

    private boolean requireBool(Value v, Token op) {
        if (v.type != Value.Type.BOOL) {
            throw OxError.type(op, "Operand of '" + op.lexeme + "' must be a bool, got " + v.typeName());
        }
        return v.asBool();
    }

    @Override
    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case MINUS:
                if (right.type != Value.Type.NUMBER) {
                    throw OxError.type(expr.operator, "Operand of '-' must be a number, got " + right.typeName());
                }
                return Value.number(-right.asNumber());
            case BANG:
                return Value.bool(!requireBool(right, expr.operator));
            default:
                throw OxError.type(expr.operator, "Unsupported unary operator '" + expr.operator.lexeme + "'");
        }
    }

    @Override
    public Value visitCallExpr(Call expr) {
        Value callee = eval(expr.callee);
        List<Value> args = new ArrayList<>(expr.arguments.size());
        for (ExprInterface a : expr.arguments) args.add(eval(a));
        return callValue(callee, args, expr.paren);
    }

    private Value callValue(Value callee, List<Value> args, Token site) {
        switch (callee.type) {
            case FUNCTION:
                return invoke(callee.asFunction(), args, site);
            case STRUCT_TYPE:
                try {
                    return Value.instance(new StructInstance(callee.asStructType(), args));
                } catch (OxError e) {
                    throw e.locateIfUnknown(site);
                }
            default:
                throw OxError.type(site, "Can only call functions and structs, got " + callee.typeName());
        }
    }

    @Override
    public Value visitMethodCallExpr(MethodCallExpr expr) {
        Value receiver = eval(expr.receiver);
        String name = expr.method.lexeme;
        if (receiver.type != Value.Type.STRUCT_INSTANCE) {
            throw OxError.type(expr.method, "Cannot call method '" + name + "' on " + receiver.typeName());
        }
        StructDef def = receiver.asInstance().def;
        Callable method = def.findInstance(name);
        if (method == null) {
            throw OxError.name(expr.method, def.name + " has no method '" + name + "'");
        }

        List<Value> args = new ArrayList<>(expr.arguments.size() + 1);
        args.add(receiver);
        for (ExprInterface a : expr.arguments) args.add(eval(a));
        return invoke(method, args, expr.method);
    }

    @Override
    public Value visitGetExpr(GetExpr expr) {
        Value receiver = eval(expr.receiver);
        String name = expr.name.lexeme;

        if (receiver.type == Value.Type.STRUCT_INSTANCE) {
            StructInstance inst = receiver.asInstance();
            if (inst.fields.containsKey(name)) return inst.fields.get(name);

            Callable method = inst.def.findInstance(name);
            if (method != null) return Value.function(new BoundMethod(receiver, method));

            Callable fn = inst.def.findStatic(name);
            if (fn != null) return Value.function(fn);

            throw OxError.name(expr.name, inst.def.name + " has no field or method '" + name + "'");
        }

        if (receiver.type == Value.Type.STRUCT_TYPE) {
            StructDef def = receiver.asStructType();
            Callable fn = def.findStatic(name);
            if (fn == null) fn = def.findInstance(name); // unbound: receiver passed explicitly
            if (fn != null) return Value.function(fn);
            throw OxError.name(expr.name, def.name + " has no method '" + name + "'");
        }

        throw OxError.type(expr.name, "Cannot read '" + name + "' of " + receiver.typeName());
    }

    @Override
    public Value visitIndexExpr(IndexExpr expr) {
        Value container = eval(expr.target);
        Value idx = eval(expr.index);

        if (container.type == Value.Type.ARRAY) {
            List<Value> items = container.asArray();
            int i = toIndex(idx, expr.bracket);
            checkBounds(i, items.size(), expr.bracket);
            return items.get(i);
        }
        if (container.type == Value.Type.STRING) {
            String s = container.asString();
            int i = toIndex(idx, expr.bracket);
            checkBounds(i, s.length(), expr.bracket);
            return Value.string(String.valueOf(s.charAt(i)));
        }
        throw OxError.type(expr.bracket, "Cannot index into " + container.typeName());
    }

    private int toIndex(Value idx, Token at) {
        if (idx.type != Value.Type.NUMBER) {
            throw OxError.type(at, "Index must be a number, got " + idx.typeName());
        }
        double d = idx.asNumber();
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw OxError.type(at, "Index must be an integer, got " + d);
        }
        if (d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
            throw OxError.index(at, "Index " + (long) d + " out of range");
        }
        return (int) d;
    }

    private void checkBounds(int i, int size, Token at) {
        if (i < 0 || i >= size) {
            throw OxError.index(at, "Index " + i + " out of range for length " + size);
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    Value invoke(Callable fn, List<Value> args, Token site) {
        if (callStack.size() >= maxDepth) {
            throw OxError.at(ErrorKind.STACK_OVERFLOW, site,
                    "Maximum recursion depth of " + maxDepth + " exceeded calling " + fn.name() + "()");
        }

        CallFrame frame = new CallFrame(fn.name(), site);
        callStack.push(frame);
        if (traceCalls && Debug.get().isEnabled(DebugLevel.TRACE)) {
            Debug.get().t(TAG, "call " + fn.name() + args + " depth=" + callStack.size());
        }
        try {
            return fn.call(this, args);
        } catch (OxError e) {
            e.locateIfUnknown(site);
            e.addFrame(frame.describe());
            throw e;
        } catch (StackOverflowError so) {
            OxError e = hostOverflow(so);
            e.locateIfUnknown(site);
            throw e;
        } finally {
            callStack.pop();
        }
    }

    private OxError hostOverflow(StackOverflowError so) {
        return new OxError(ErrorKind.STACK_OVERFLOW,
                "Host stack exhausted at call depth " + callStack.size(), 0, 0, so);
    }

    // -------------------------
    // Control signals
    // -------------------------

    public static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        final Value value;
        ReturnSignal(Value value) { super(null, null, false, false); this.value = value; }
    }

    public static final class BreakSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        BreakSignal() { super(null, null, false, false); }
    }

    public static final class ContinueSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;
        ContinueSignal() { super(null, null, false, false); }
    }
}
