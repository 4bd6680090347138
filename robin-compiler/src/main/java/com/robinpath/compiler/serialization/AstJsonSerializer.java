package com.robinpath.compiler.serialization;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.Decorator;
import com.robinpath.compiler.ast.IntoTarget;
import com.robinpath.compiler.ast.LiteralType;
import com.robinpath.compiler.ast.PathSegment;
import com.robinpath.compiler.ast.expr.*;
import com.robinpath.compiler.ast.stmt.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 语法树与 JSON 之间的转换
 *
 * <p>节点以 {@code type} 字段区分种类，位置字段名为 {@code codePos}。
 * 缺省的可选字段不输出；布尔标志只在为 true 时输出。</p>
 */
public class AstJsonSerializer {

    private final ModuleResolver moduleResolver;

    public AstJsonSerializer() {
        this(new ModuleResolver());
    }

    public AstJsonSerializer(ModuleResolver moduleResolver) {
        this.moduleResolver = moduleResolver;
    }

    // ============ 输出 ============

    public String toJsonString(List<Statement> statements, boolean pretty) {
        GsonBuilder builder = new GsonBuilder().serializeNulls().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        Gson gson = builder.create();
        return gson.toJson(toJson(statements));
    }

    public JsonArray toJson(List<Statement> statements) {
        JsonArray array = new JsonArray();
        for (Statement s : statements) {
            array.add(toJson(s));
        }
        return array;
    }

    public JsonObject toJson(Statement stmt) {
        JsonObject json = new JsonObject();
        json.addProperty("type", stmt.getKind());
        addPosition(json, "codePos", stmt.getPosition());
        if (!stmt.getComments().isEmpty()) {
            JsonArray comments = new JsonArray();
            for (Comment c : stmt.getComments()) {
                comments.add(commentJson(c));
            }
            json.add("comments", comments);
        }

        if (stmt instanceof CommandStmt) {
            CommandStmt cmd = (CommandStmt) stmt;
            json.addProperty("name", cmd.getName());
            String module = cmd.getModule() != null ? cmd.getModule() : moduleResolver.resolve(cmd.getName());
            if (module != null) {
                json.addProperty("module", module);
            }
            json.add("args", expressions(cmd.getArgs()));
            json.addProperty("syntaxType", cmd.getSyntaxType().getLabel());
            addInto(json, cmd.getInto());
            if (cmd.getCallback() != null) {
                json.add("callback", toJson(cmd.getCallback()));
            }
        } else if (stmt instanceof AssignmentStmt) {
            AssignmentStmt a = (AssignmentStmt) stmt;
            json.addProperty("targetName", a.getTargetName());
            addPath(json, "targetPath", a.getTargetPath());
            addFlag(json, "isSet", a.isSet());
            addFlag(json, "isImplicit", a.isImplicit());
            addFlag(json, "hasAs", a.isHasAs());
            addFlag(json, "isLastValue", a.isLastValue());
            if (a.getCommand() != null) {
                json.add("command", toJson(a.getCommand()));
            }
            if (a.hasLiteralValue()) {
                json.add("literalValue", JsonValues.toElement(a.getLiteralValue()));
            }
            if (a.getLiteralValueType() != null) {
                json.addProperty("literalValueType", a.getLiteralValueType().getLabel());
            }
        } else if (stmt instanceof ShorthandStmt) {
            json.addProperty("targetName", ((ShorthandStmt) stmt).getTargetName());
        } else if (stmt instanceof InlineIfStmt) {
            InlineIfStmt s = (InlineIfStmt) stmt;
            json.add("conditionExpr", toJson(s.getConditionExpr()));
            json.add("command", toJson(s.getCommand()));
        } else if (stmt instanceof IfTrueStmt) {
            json.add("command", toJson(((IfTrueStmt) stmt).getCommand()));
        } else if (stmt instanceof IfFalseStmt) {
            json.add("command", toJson(((IfFalseStmt) stmt).getCommand()));
        } else if (stmt instanceof IfBlockStmt) {
            IfBlockStmt s = (IfBlockStmt) stmt;
            json.add("conditionExpr", toJson(s.getConditionExpr()));
            addFlag(json, "hasThen", s.isHasThen());
            json.add("thenBranch", toJson(s.getThenBranch()));
            if (!s.getElseifBranches().isEmpty()) {
                JsonArray branches = new JsonArray();
                for (ElseIfBranch b : s.getElseifBranches()) {
                    JsonObject branch = new JsonObject();
                    branch.add("conditionExpr", toJson(b.getConditionExpr()));
                    branch.add("body", toJson(b.getBody()));
                    addPosition(branch, "codePos", b.getPosition());
                    branches.add(branch);
                }
                json.add("elseifBranches", branches);
            }
            if (s.hasElse()) {
                json.add("elseBranch", toJson(s.getElseBranch()));
            }
            addPosition(json, "elseCodePos", s.getElsePosition());
        } else if (stmt instanceof DefineStmt) {
            DefineStmt s = (DefineStmt) stmt;
            json.addProperty("name", s.getName());
            json.add("paramNames", strings(s.getParamNames()));
            addDecorators(json, s.getDecorators());
            json.add("body", toJson(s.getBody()));
        } else if (stmt instanceof DoStmt) {
            DoStmt s = (DoStmt) stmt;
            json.add("paramNames", strings(s.getParamNames()));
            addInto(json, s.getInto());
            json.add("body", toJson(s.getBody()));
        } else if (stmt instanceof TogetherStmt) {
            json.add("blocks", toJson(((TogetherStmt) stmt).getBlocks()));
        } else if (stmt instanceof ForLoopStmt) {
            ForLoopStmt s = (ForLoopStmt) stmt;
            json.addProperty("varName", s.getVarName());
            if (s.getRange() != null) {
                json.add("range", toJson(s.getRange()));
            }
            if (s.getIterable() != null) {
                json.add("iterable", toJson(s.getIterable()));
            }
            json.add("body", toJson(s.getBody()));
        } else if (stmt instanceof OnBlockStmt) {
            OnBlockStmt s = (OnBlockStmt) stmt;
            json.addProperty("eventName", s.getEventName());
            addDecorators(json, s.getDecorators());
            json.add("body", toJson(s.getBody()));
        } else if (stmt instanceof ReturnStmt) {
            ReturnStmt s = (ReturnStmt) stmt;
            if (s.hasValue()) {
                json.add("value", toJson(s.getValue()));
            }
        } else if (stmt instanceof ChunkMarkerStmt) {
            ChunkMarkerStmt s = (ChunkMarkerStmt) stmt;
            json.addProperty("id", s.getId());
            json.add("meta", stringMap(s.getMeta()));
        } else if (stmt instanceof CellStmt) {
            CellStmt s = (CellStmt) stmt;
            json.addProperty("cellType", s.getCellType());
            json.add("meta", stringMap(s.getMeta()));
            if (s.getBody() != null) {
                json.add("body", toJson(s.getBody()));
            }
            if (s.getRawBody() != null) {
                json.addProperty("rawBody", s.getRawBody());
            }
        } else if (stmt instanceof PromptBlockStmt) {
            PromptBlockStmt s = (PromptBlockStmt) stmt;
            json.addProperty("rawText", s.getRawText());
            addPosition(json, "bodyPos", s.getBodyPos());
        }
        // break / continue / comment 没有额外字段
        return json;
    }

    public JsonObject toJson(Expression expr) {
        JsonObject json = new JsonObject();
        if (expr == null) {
            return json;
        }
        json.addProperty("type", expr.getKind());
        addPosition(json, "codePos", expr.getPosition());

        if (expr instanceof VarExpr) {
            VarExpr e = (VarExpr) expr;
            json.addProperty("name", e.getName());
            addPath(json, "path", e.getPath());
        } else if (expr instanceof StringExpr) {
            json.addProperty("value", ((StringExpr) expr).getValue());
        } else if (expr instanceof NumberExpr) {
            json.add("value", JsonValues.numberElement(((NumberExpr) expr).getValue()));
        } else if (expr instanceof LiteralExpr) {
            json.add("value", JsonValues.toElement(((LiteralExpr) expr).getValue()));
        } else if (expr instanceof SubexprCodeExpr) {
            json.addProperty("code", ((SubexprCodeExpr) expr).getCode());
        } else if (expr instanceof ObjectCodeExpr) {
            json.addProperty("code", ((ObjectCodeExpr) expr).getCode());
        } else if (expr instanceof ArrayCodeExpr) {
            json.addProperty("code", ((ArrayCodeExpr) expr).getCode());
        } else if (expr instanceof RawExpr) {
            json.addProperty("code", ((RawExpr) expr).getCode());
        } else if (expr instanceof SubexpressionExpr) {
            json.add("body", toJson(((SubexpressionExpr) expr).getBody()));
        } else if (expr instanceof ObjectLiteralExpr) {
            json.add("properties", expressionMap(((ObjectLiteralExpr) expr).getProperties()));
        } else if (expr instanceof ArrayLiteralExpr) {
            json.add("elements", expressions(((ArrayLiteralExpr) expr).getElements()));
        } else if (expr instanceof BinaryExpr) {
            BinaryExpr e = (BinaryExpr) expr;
            json.add("left", toJson(e.getLeft()));
            json.addProperty("operator", e.getOperator());
            if (e.getOperatorText() != null) {
                json.addProperty("operatorText", e.getOperatorText());
            }
            json.add("right", toJson(e.getRight()));
            addFlag(json, "parenthesized", e.isParenthesized());
        } else if (expr instanceof UnaryExpr) {
            UnaryExpr e = (UnaryExpr) expr;
            json.addProperty("operator", e.getOperator());
            json.add("argument", toJson(e.getArgument()));
        } else if (expr instanceof CallExpr) {
            CallExpr e = (CallExpr) expr;
            json.addProperty("callee", e.getCallee());
            json.add("args", expressions(e.getArgs()));
        } else if (expr instanceof NamedArgsExpr) {
            json.add("args", expressionMap(((NamedArgsExpr) expr).getArgs()));
        } else if (expr instanceof RangeExpr) {
            RangeExpr e = (RangeExpr) expr;
            json.add("from", toJson(e.getFrom()));
            json.add("to", toJson(e.getTo()));
        }
        // lastValue 没有额外字段
        return json;
    }

    private JsonObject commentJson(Comment c) {
        JsonObject json = new JsonObject();
        json.addProperty("text", c.getText());
        addPosition(json, "codePos", c.getPosition());
        json.addProperty("inline", c.isInline());
        return json;
    }

    private JsonArray expressions(List<? extends Expression> list) {
        JsonArray array = new JsonArray();
        for (Expression e : list) {
            array.add(toJson(e));
        }
        return array;
    }

    private JsonObject expressionMap(Map<String, Expression> map) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, Expression> e : map.entrySet()) {
            json.add(e.getKey(), toJson(e.getValue()));
        }
        return json;
    }

    private static JsonArray strings(List<String> list) {
        JsonArray array = new JsonArray();
        for (String s : list) {
            array.add(s);
        }
        return array;
    }

    private static JsonObject stringMap(Map<String, String> map) {
        JsonObject json = new JsonObject();
        for (Map.Entry<String, String> e : map.entrySet()) {
            json.addProperty(e.getKey(), e.getValue());
        }
        return json;
    }

    private void addDecorators(JsonObject json, List<Decorator> decorators) {
        if (decorators.isEmpty()) {
            return;
        }
        JsonArray array = new JsonArray();
        for (Decorator d : decorators) {
            JsonObject decorator = new JsonObject();
            decorator.addProperty("name", d.getName());
            decorator.add("args", expressions(d.getArgs()));
            addPosition(decorator, "codePos", d.getPosition());
            array.add(decorator);
        }
        json.add("decorators", array);
    }

    private static void addInto(JsonObject json, IntoTarget into) {
        if (into == null) {
            return;
        }
        JsonObject target = new JsonObject();
        target.addProperty("targetName", into.getTargetName());
        addPath(target, "targetPath", into.getTargetPath());
        json.add("into", target);
    }

    private static void addPath(JsonObject json, String field, List<PathSegment> path) {
        if (path == null || path.isEmpty()) {
            return;
        }
        JsonArray array = new JsonArray();
        for (PathSegment seg : path) {
            JsonObject segment = new JsonObject();
            segment.addProperty("type", seg.isProperty() ? "property" : "index");
            segment.addProperty("value", seg.getValue());
            array.add(segment);
        }
        json.add(field, array);
    }

    private static void addFlag(JsonObject json, String field, boolean value) {
        if (value) {
            json.addProperty(field, true);
        }
    }

    private static void addPosition(JsonObject json, String field, CodePosition pos) {
        if (pos == null) {
            return;
        }
        JsonObject p = new JsonObject();
        p.addProperty("startRow", pos.getStartRow());
        p.addProperty("startCol", pos.getStartCol());
        p.addProperty("endRow", pos.getEndRow());
        p.addProperty("endCol", pos.getEndCol());
        json.add(field, p);
    }

    // ============ 读取 ============

    /**
     * 从 JSON 文本读取语句列表
     *
     * @throws JsonParseException JSON 格式错误或包含未知节点类型
     */
    public List<Statement> fromJson(String json) {
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonArray()) {
            throw new JsonParseException("Expected a JSON array of statements");
        }
        return statements(root.getAsJsonArray());
    }

    public List<Statement> statements(JsonArray array) {
        List<Statement> result = new ArrayList<Statement>();
        for (JsonElement e : array) {
            result.add(statement(e.getAsJsonObject()));
        }
        return result;
    }

    public Statement statement(JsonObject json) {
        String type = string(json, "type");
        CodePosition pos = position(json, "codePos");
        Statement stmt;
        if (type == null) {
            throw new JsonParseException("Statement without type: " + json);
        }
        switch (type) {
            case "command": {
                String name = string(json, "name");
                String module = json.has("module") ? string(json, "module") : ModuleResolver.moduleOf(name);
                CommandStmt.SyntaxType syntaxType = json.has("syntaxType")
                        ? CommandStmt.SyntaxType.fromLabel(string(json, "syntaxType"))
                        : CommandStmt.SyntaxType.SPACE;
                DoStmt callback = json.has("callback") ? (DoStmt) statement(json.getAsJsonObject("callback")) : null;
                stmt = new CommandStmt(pos, name, module, expressionList(json, "args"), into(json),
                        syntaxType, callback);
                break;
            }
            case "assignment": {
                AssignmentStmt a = new AssignmentStmt(pos, string(json, "targetName"));
                a.setTargetPath(path(json, "targetPath"));
                a.setSet(flag(json, "isSet"));
                a.setImplicit(flag(json, "isImplicit"));
                a.setHasAs(flag(json, "hasAs"));
                a.setLastValue(flag(json, "isLastValue"));
                if (json.has("command") && json.get("command").isJsonObject()) {
                    a.setCommand((CommandStmt) statement(json.getAsJsonObject("command")));
                }
                if (json.has("literalValue")) {
                    a.setLiteralValue(JsonValues.fromElement(json.get("literalValue")));
                }
                if (json.has("literalValueType")) {
                    a.setLiteralValueType(LiteralType.fromLabel(string(json, "literalValueType")));
                }
                stmt = a;
                break;
            }
            case "shorthand":
                stmt = new ShorthandStmt(pos, string(json, "targetName"));
                break;
            case "inlineIf":
                stmt = new InlineIfStmt(pos, condition(json.get("conditionExpr")),
                        statement(json.getAsJsonObject("command")));
                break;
            case "ifTrue":
                stmt = new IfTrueStmt(pos, statement(json.getAsJsonObject("command")));
                break;
            case "ifFalse":
                stmt = new IfFalseStmt(pos, statement(json.getAsJsonObject("command")));
                break;
            case "ifBlock": {
                List<ElseIfBranch> branches = new ArrayList<ElseIfBranch>();
                if (json.has("elseifBranches")) {
                    for (JsonElement e : json.getAsJsonArray("elseifBranches")) {
                        JsonObject b = e.getAsJsonObject();
                        branches.add(new ElseIfBranch(condition(b.get("conditionExpr")), statementList(b, "body"),
                                position(b, "codePos")));
                    }
                }
                List<Statement> elseBranch = json.has("elseBranch") ? statementList(json, "elseBranch") : null;
                IfBlockStmt block = new IfBlockStmt(pos, condition(json.get("conditionExpr")), flag(json, "hasThen"),
                        statementList(json, "thenBranch"), branches, elseBranch);
                block.setElsePosition(position(json, "elseCodePos"));
                stmt = block;
                break;
            }
            case "define":
                stmt = new DefineStmt(pos, string(json, "name"), stringList(json, "paramNames"),
                        decorators(json), statementList(json, "body"));
                break;
            case "do":
                stmt = new DoStmt(pos, stringList(json, "paramNames"), into(json), statementList(json, "body"));
                break;
            case "together":
                stmt = new TogetherStmt(pos, statementList(json, "blocks"));
                break;
            case "forLoop": {
                RangeExpr range = json.has("range") ? (RangeExpr) expression(json.getAsJsonObject("range")) : null;
                Expression iterable = json.has("iterable") ? condition(json.get("iterable")) : null;
                stmt = new ForLoopStmt(pos, string(json, "varName"), range, iterable, statementList(json, "body"));
                break;
            }
            case "onBlock":
                stmt = new OnBlockStmt(pos, string(json, "eventName"), decorators(json), statementList(json, "body"));
                break;
            case "return":
                stmt = new ReturnStmt(pos, json.has("value") ? expression(json.getAsJsonObject("value")) : null);
                break;
            case "break":
                stmt = new BreakStmt(pos);
                break;
            case "continue":
                stmt = new ContinueStmt(pos);
                break;
            case "comment":
                stmt = new CommentStmt(pos, new ArrayList<Comment>());
                break;
            case "chunk_marker":
                stmt = new ChunkMarkerStmt(pos, string(json, "id"), stringMap(json, "meta"));
                break;
            case "cell":
                stmt = new CellStmt(pos, string(json, "cellType"), stringMap(json, "meta"),
                        json.has("body") ? statementList(json, "body") : null, string(json, "rawBody"));
                break;
            case "prompt_block":
                stmt = new PromptBlockStmt(pos, string(json, "rawText"), position(json, "bodyPos"));
                break;
            default:
                throw new JsonParseException("Unknown statement type: " + type);
        }
        stmt.setComments(comments(json));
        return stmt;
    }

    public Expression expression(JsonObject json) {
        String type = string(json, "type");
        if (type == null) {
            throw new JsonParseException("Expression without type: " + json);
        }
        Expression expr;
        switch (type) {
            case "var":
                expr = new VarExpr(string(json, "name"), path(json, "path"));
                break;
            case "string":
                expr = new StringExpr(string(json, "value"));
                break;
            case "number":
                expr = new NumberExpr(json.get("value").getAsDouble());
                break;
            case "literal":
                expr = new LiteralExpr(json.has("value") ? JsonValues.fromElement(json.get("value")) : null);
                break;
            case "lastValue":
                expr = new LastValueExpr();
                break;
            case "subexpr":
                expr = new SubexprCodeExpr(string(json, "code"));
                break;
            case "object":
                expr = new ObjectCodeExpr(string(json, "code"));
                break;
            case "array":
                expr = new ArrayCodeExpr(string(json, "code"));
                break;
            case "raw":
                expr = new RawExpr(string(json, "code"));
                break;
            case "subexpression":
                expr = new SubexpressionExpr(statementList(json, "body"));
                break;
            case "objectLiteral":
                expr = new ObjectLiteralExpr(expressionMap(json, "properties"));
                break;
            case "arrayLiteral":
                expr = new ArrayLiteralExpr(expressionList(json, "elements"));
                break;
            case "binary":
                expr = new BinaryExpr(expression(json.getAsJsonObject("left")), string(json, "operator"),
                        string(json, "operatorText"), expression(json.getAsJsonObject("right")),
                        flag(json, "parenthesized"));
                break;
            case "unary":
                expr = new UnaryExpr(string(json, "operator"), expression(json.getAsJsonObject("argument")));
                break;
            case "call":
                expr = new CallExpr(string(json, "callee"), expressionList(json, "args"));
                break;
            case "namedArgs":
                expr = new NamedArgsExpr(expressionMap(json, "args"));
                break;
            case "range":
                expr = new RangeExpr(expression(json.getAsJsonObject("from")), expression(json.getAsJsonObject("to")));
                break;
            default:
                throw new JsonParseException("Unknown expression type: " + type);
        }
        expr.setPosition(position(json, "codePos"));
        return expr;
    }

    /** 条件可以是表达式对象，也可以是原始源码字符串 */
    private Expression condition(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return new RawExpr(element.getAsString());
        }
        JsonObject object = element.getAsJsonObject();
        return object.has("type") ? expression(object) : null;
    }

    private List<Statement> statementList(JsonObject json, String field) {
        if (!json.has(field) || json.get(field).isJsonNull()) {
            return new ArrayList<Statement>();
        }
        return statements(json.getAsJsonArray(field));
    }

    private List<Expression> expressionList(JsonObject json, String field) {
        List<Expression> result = new ArrayList<Expression>();
        if (json.has(field) && json.get(field).isJsonArray()) {
            for (JsonElement e : json.getAsJsonArray(field)) {
                result.add(expression(e.getAsJsonObject()));
            }
        }
        return result;
    }

    private Map<String, Expression> expressionMap(JsonObject json, String field) {
        Map<String, Expression> result = new LinkedHashMap<String, Expression>();
        if (json.has(field) && json.get(field).isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : json.getAsJsonObject(field).entrySet()) {
                result.put(e.getKey(), expression(e.getValue().getAsJsonObject()));
            }
        }
        return result;
    }

    private List<Decorator> decorators(JsonObject json) {
        List<Decorator> result = new ArrayList<Decorator>();
        if (json.has("decorators")) {
            for (JsonElement e : json.getAsJsonArray("decorators")) {
                JsonObject d = e.getAsJsonObject();
                result.add(new Decorator(string(d, "name"), expressionList(d, "args"), position(d, "codePos")));
            }
        }
        return result;
    }

    private static List<Comment> comments(JsonObject json) {
        List<Comment> result = new ArrayList<Comment>();
        if (json.has("comments")) {
            for (JsonElement e : json.getAsJsonArray("comments")) {
                JsonObject c = e.getAsJsonObject();
                String text = string(c, "text");
                result.add(new Comment(text != null ? text : "", position(c, "codePos"), flag(c, "inline")));
            }
        }
        return result;
    }

    private static IntoTarget into(JsonObject json) {
        if (!json.has("into") || !json.get("into").isJsonObject()) {
            return null;
        }
        JsonObject into = json.getAsJsonObject("into");
        return new IntoTarget(string(into, "targetName"), path(into, "targetPath"));
    }

    private static List<PathSegment> path(JsonObject json, String field) {
        List<PathSegment> result = new ArrayList<PathSegment>();
        if (json.has(field) && json.get(field).isJsonArray()) {
            for (JsonElement e : json.getAsJsonArray(field)) {
                JsonObject seg = e.getAsJsonObject();
                String value = string(seg, "value");
                result.add("index".equals(string(seg, "type")) ? PathSegment.index(value) : PathSegment.property(value));
            }
        }
        return result;
    }

    private static List<String> stringList(JsonObject json, String field) {
        List<String> result = new ArrayList<String>();
        if (json.has(field) && json.get(field).isJsonArray()) {
            for (JsonElement e : json.getAsJsonArray(field)) {
                result.add(e.getAsString());
            }
        }
        return result;
    }

    private static Map<String, String> stringMap(JsonObject json, String field) {
        Map<String, String> result = new LinkedHashMap<String, String>();
        if (json.has(field) && json.get(field).isJsonObject()) {
            for (Map.Entry<String, JsonElement> e : json.getAsJsonObject(field).entrySet()) {
                result.put(e.getKey(), e.getValue().isJsonNull() ? null : e.getValue().getAsString());
            }
        }
        return result;
    }

    private static CodePosition position(JsonObject json, String field) {
        if (!json.has(field) || !json.get(field).isJsonObject()) {
            return null;
        }
        JsonObject p = json.getAsJsonObject(field);
        return new CodePosition(p.get("startRow").getAsInt(), p.get("startCol").getAsInt(),
                p.get("endRow").getAsInt(), p.get("endCol").getAsInt());
    }

    private static String string(JsonObject json, String field) {
        JsonElement e = json.get(field);
        return e == null || e instanceof JsonNull ? null : e.getAsString();
    }

    private static boolean flag(JsonObject json, String field) {
        JsonElement e = json.get(field);
        return e instanceof JsonPrimitive && e.getAsBoolean();
    }
}
