package com.robinpath.compiler.regen;

import com.robinpath.compiler.ast.CodePosition;
import com.robinpath.compiler.ast.Comment;
import com.robinpath.compiler.ast.Decorator;
import com.robinpath.compiler.ast.stmt.*;
import com.robinpath.compiler.formatter.FormatConfig;
import com.robinpath.compiler.formatter.LineIndex;
import com.robinpath.compiler.formatter.PositionOutOfRangeException;
import com.robinpath.compiler.formatter.PrintContext;
import com.robinpath.compiler.formatter.PrintDiagnostic;
import com.robinpath.compiler.formatter.StatementPrinter;
import com.robinpath.compiler.lexer.Lexer;
import com.robinpath.compiler.parser.Parser;
import com.robinpath.compiler.serialization.AstJsonSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * 源码再生成器：根据修改后的语法树生成新源码，尽量保留原文。
 *
 * <p>修改后的语句按位置与原语句配对。未改动的语句（JSON 结构相同）整段照抄原文；
 * 改动过的语句逐部分重建：前导注释、装饰器、头部、行尾注释在未变时照抄，
 * 语句体逐段递归，结束行照抄。新增的语句按规范格式打印。</p>
 *
 * <p>节点位置与源码不符时只重新打印该节点，并记录 {@code POSITION_OUT_OF_RANGE} 诊断。</p>
 *
 * <p>重新打印的行使用原文的换行符（{@code \n} 或 {@code \r\n}），由原文第一个换行决定。</p>
 */
public class SourceRegenerator {

    private static final Logger LOG = Logger.getLogger(SourceRegenerator.class.getName());

    private static final Pattern LONE_LF = Pattern.compile("(?<!\r)\n");

    private final FormatConfig config;
    private final StatementPrinter printer = new StatementPrinter();
    private final AstJsonSerializer serializer = new AstJsonSerializer();

    public SourceRegenerator() {
        this(new FormatConfig());
    }

    public SourceRegenerator(FormatConfig config) {
        this.config = config;
    }

    /**
     * 重新解析原始源码得到原语法树，再与 mutated 对照生成
     */
    public RegenerationResult regenerate(String source, List<Statement> mutated) {
        String text = source != null ? source : "";
        List<Statement> original = new Parser(new Lexer(text), config.getMaxDepth()).parseTolerant().getStatements();
        return regenerate(text, original, mutated);
    }

    public RegenerationResult regenerate(String source, List<Statement> original, List<Statement> mutated) {
        String text = source != null ? source : "";
        Session session = new Session(text);
        String result = session.body(original, mutated, 0, session.index.lineCount() - 1, "");
        if (text.endsWith("\n")) {
            if (!result.isEmpty() && !result.endsWith("\n")) {
                result = result + session.eol;
            }
        } else if (result.endsWith("\r\n")) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith("\n")) {
            result = result.substring(0, result.length() - 1);
        }
        return new RegenerationResult(result, session.ctx.getDiagnostics());
    }

    /** 一次再生成调用的状态：源码行索引和共享诊断的打印上下文 */
    private class Session {
        final LineIndex index;
        final String eol;
        final PrintContext ctx = PrintContext.create(config);
        final Set<Statement> used = Collections.newSetFromMap(new IdentityHashMap<Statement, Boolean>());

        Session(String source) {
            this.index = new LineIndex(source);
            this.eol = lineEnding(source);
        }

        // ============ 语句体 ============

        /**
         * 再生成一个语句体。[fromRow, toRow] 是该语句体在原文中占据的行，
         * indent 是新增语句使用的缩进。
         */
        String body(List<Statement> original, List<Statement> mutated, int fromRow, int toRow, String indent) {
            List<Statement> orig = new ArrayList<Statement>();
            if (original != null) {
                for (Statement s : original) {
                    if (s == null || s.getPosition() == null) continue;
                    if (s.getExtentStartRow() < fromRow || s.getPosition().getEndRow() > toRow) {
                        // 位置落在语句体之外，不参与照抄
                        ctx.report(PrintDiagnostic.Kind.POSITION_OUT_OF_RANGE,
                                "Statement rows outside of rows " + fromRow + ".." + toRow, s.getPosition());
                        continue;
                    }
                    orig.add(s);
                }
            }
            List<Statement> items = new ArrayList<Statement>();
            if (mutated != null) {
                for (Statement s : mutated) {
                    if (s instanceof CommentStmt && ((CommentStmt) s).isEmpty()) continue;
                    items.add(s);
                }
            }
            if (orig.isEmpty() && items.isEmpty()) {
                return lines(fromRow, toRow);
            }

            StringBuilder out = new StringBuilder();
            if (!orig.isEmpty()) {
                out.append(lines(fromRow, orig.get(0).getExtentStartRow() - 1));
            }
            Statement prev = null;
            Statement prevOrig = null;
            for (Statement stmt : items) {
                Statement match = match(orig, stmt);
                if (prev != null && stmt != null) {
                    append(out, gap(orig, prev, prevOrig, stmt, match));
                }
                append(out, statement(stmt, match, indent));
                if (stmt != null) {
                    prev = stmt;
                    prevOrig = match;
                }
            }
            if (!orig.isEmpty()) {
                Statement last = orig.get(orig.size() - 1);
                append(out, lines(last.getPosition().getEndRow() + 1, toRow));
            }
            return out.toString();
        }

        /** 同一语句体中位置和种类都相同、且尚未配对的原语句 */
        private Statement match(List<Statement> orig, Statement stmt) {
            if (stmt == null || stmt.getPosition() == null) {
                return null;
            }
            for (Statement o : orig) {
                if (!used.contains(o) && o.getPosition().equals(stmt.getPosition())
                        && o.getKind().equals(stmt.getKind())) {
                    used.add(o);
                    return o;
                }
            }
            return null;
        }

        /**
         * 两条输出语句之间的空行：原本相邻的照抄原间隔；前一条是原语句时沿用它之后的间隔；
         * 否则按位置推断
         */
        private String gap(List<Statement> orig, Statement prev, Statement prevOrig, Statement next, Statement nextOrig) {
            if (prevOrig != null) {
                int i = orig.indexOf(prevOrig);
                int from = prevOrig.getPosition().getEndRow() + 1;
                if (nextOrig != null && orig.indexOf(nextOrig) == i + 1) {
                    return lines(from, nextOrig.getExtentStartRow() - 1);
                }
                if (i + 1 < orig.size()) {
                    return lines(from, orig.get(i + 1).getExtentStartRow() - 1);
                }
                return "";
            }
            return withEol(printer.printSiblingGap(prev, next));
        }

        private String statement(Statement stmt, Statement original, String indent) {
            if (original == null) {
                return withEol(printer.printStatement(stmt, ctx.withBasePrefix(indent)));
            }
            try {
                if (sameTree(original, stmt)) {
                    return lines(original.getExtentStartRow(), original.getPosition().getEndRow());
                }
                return rebuild(original, stmt);
            } catch (PositionOutOfRangeException e) {
                LOG.fine("Falling back to printer for " + stmt.getKind() + ": " + e.getMessage());
                ctx.report(PrintDiagnostic.Kind.POSITION_OUT_OF_RANGE, e.getMessage(), stmt.getPosition());
                return withEol(printer.printStatement(stmt, ctx.withBasePrefix(indent)));
            }
        }

        private boolean sameTree(Statement a, Statement b) {
            return serializer.toJson(a).equals(serializer.toJson(b));
        }

        // ============ 逐部分重建 ============

        private String rebuild(Statement o, Statement m) {
            String indent = index.leadingWhitespace(o.getPosition().getStartRow());
            PrintContext at = ctx.withBasePrefix(indent);
            // 独立注释组没有头部，整组重新打印
            if (o instanceof CommentStmt || !sameShape(o, m)) {
                return withEol(printer.printStatement(m, at));
            }
            StringBuilder out = new StringBuilder();
            out.append(leadingComments(o, m, indent));
            out.append(decorators(o, m, at));
            out.append(header(o, m, at));
            if (o.isBlock()) {
                out.append(sections(o, m, indent));
                out.append(terminated(lines(o.getPosition().getEndRow(), o.getPosition().getEndRow())));
            }
            return out.toString();
        }

        /** 语句体的段落结构是否一致；不一致时整条语句重新打印 */
        private boolean sameShape(Statement o, Statement m) {
            if (o instanceof PromptBlockStmt) {
                return false;
            }
            if (o instanceof CellStmt) {
                CellStmt oc = (CellStmt) o;
                CellStmt mc = (CellStmt) m;
                return oc.isCode() && mc.isCode() && oc.isBlock() == mc.isBlock();
            }
            if (o instanceof CommandStmt) {
                return (((CommandStmt) o).getCallback() == null) == (((CommandStmt) m).getCallback() == null);
            }
            if (o instanceof IfBlockStmt) {
                IfBlockStmt ob = (IfBlockStmt) o;
                IfBlockStmt mb = (IfBlockStmt) m;
                return ob.getElseifBranches().size() == mb.getElseifBranches().size()
                        && ob.hasElse() == mb.hasElse();
            }
            return true;
        }

        private String leadingComments(Statement o, Statement m, String indent) {
            List<Comment> ol = o.getLeadingComments();
            List<Comment> ml = m.getLeadingComments();
            StringBuilder out = new StringBuilder();
            if (texts(ol).equals(texts(ml))) {
                for (Comment c : ol) {
                    out.append(terminated(lines(positionOf(c).getStartRow(), positionOf(c).getEndRow())));
                }
                return out.toString();
            }
            for (Comment c : ml) {
                if (c.isDeleted()) continue;
                for (String line : c.getText().split("\n", -1)) {
                    String cleaned = line.replace("\r", "");
                    out.append(indent).append(cleaned.trim().isEmpty() ? "#" : "# " + cleaned).append(eol);
                }
            }
            return out.toString();
        }

        private String decorators(Statement o, Statement m, PrintContext at) {
            List<Decorator> od = decoratorsOf(o);
            List<Decorator> md = decoratorsOf(m);
            StringBuilder out = new StringBuilder();
            if (od.isEmpty() && md.isEmpty()) {
                return "";
            }
            PrintContext scratch = scratch(at);
            boolean same = od.size() == md.size();
            for (int i = 0; same && i < od.size(); i++) {
                same = printer.printDecorator(od.get(i), scratch).equals(printer.printDecorator(md.get(i), scratch));
            }
            if (same) {
                for (Decorator d : od) {
                    CodePosition pos = d.getPosition();
                    if (pos == null) {
                        throw new PositionOutOfRangeException("Decorator without position", -1, -1);
                    }
                    out.append(terminated(lines(pos.getStartRow(), pos.getEndRow())));
                }
                return out.toString();
            }
            for (Decorator d : md) {
                out.append(at.indentString()).append(printer.printDecorator(d, at)).append(eol);
            }
            return out.toString();
        }

        /**
         * 头部：规范文本不变时照抄原文（只替换改动过的行尾注释），否则重新打印
         */
        private String header(Statement o, Statement m, PrintContext at) {
            int startRow = o.getPosition().getStartRow();
            int headerEndRow = o.getHeaderEndRow();
            PrintContext scratch = scratch(at);
            String inline = printer.inlineComment(m, at);
            if (!printer.printHeader(o, scratch).equals(printer.printHeader(m, scratch))) {
                return printer.printHeader(m, at) + inline + eol;
            }
            Comment oInline = o.getInlineComment();
            Comment mInline = m.getInlineComment();
            if (sameText(oInline, mInline)) {
                return terminated(lines(startRow, headerEndRow));
            }
            int end = oInline != null
                    ? index.offsetAt(headerEndRow, positionOf(oInline).getStartCol(), false)
                    : index.lineEndOffset(headerEndRow);
            String text = index.getSource().substring(index.lineStartOffset(startRow), end);
            return rtrim(text) + inline + eol;
        }

        // ============ 语句体段落 ============

        private String sections(Statement o, Statement m, String indent) {
            int endRow = o.getPosition().getEndRow();
            int first = o.getHeaderEndRow() + 1;
            if (o instanceof IfBlockStmt) {
                return ifSections((IfBlockStmt) o, (IfBlockStmt) m, indent);
            }
            if (o instanceof CellStmt) {
                return section(((CellStmt) o).getBody(), ((CellStmt) m).getBody(), first, endRow - 1, indent, false);
            }
            return section(bodyOf(o), bodyOf(m), first, endRow - 1, indent, true);
        }

        private String ifSections(IfBlockStmt o, IfBlockStmt m, String indent) {
            List<Integer> markers = new ArrayList<Integer>();
            for (ElseIfBranch b : o.getElseifBranches()) {
                markers.add(positionOf(b.getPosition()).getStartRow());
            }
            if (o.hasElse()) {
                markers.add(positionOf(o.getElsePosition()).getStartRow());
            }
            markers.add(o.getPosition().getEndRow());

            StringBuilder out = new StringBuilder();
            out.append(section(o.getThenBranch(), m.getThenBranch(), o.getHeaderEndRow() + 1,
                    markers.get(0) - 1, indent, true));
            PrintContext scratch = scratch(ctx.withBasePrefix(indent));
            for (int i = 0; i < o.getElseifBranches().size(); i++) {
                ElseIfBranch ob = o.getElseifBranches().get(i);
                ElseIfBranch mb = m.getElseifBranches().get(i);
                int row = markers.get(i);
                if (printer.elseIfHeader(ob, scratch).equals(printer.elseIfHeader(mb, scratch))) {
                    out.append(terminated(lines(row, row)));
                } else {
                    PrintContext at = ctx.withBasePrefix(index.leadingWhitespace(row));
                    out.append(at.indentString()).append(printer.elseIfHeader(mb, at)).append(eol);
                }
                out.append(section(ob.getBody(), mb.getBody(), row + 1, markers.get(i + 1) - 1, indent, true));
            }
            if (o.hasElse()) {
                int row = markers.get(markers.size() - 2);
                out.append(terminated(lines(row, row)));
                out.append(section(o.getElseBranch(), m.getElseBranch(), row + 1,
                        markers.get(markers.size() - 1) - 1, indent, true));
            }
            return out.toString();
        }

        /**
         * @param nested 语句体是否比头部多缩进一层（code 单元格的语句体与头部同级）
         */
        private String section(List<Statement> original, List<Statement> mutated, int fromRow, int toRow,
                               String indent, boolean nested) {
            if (toRow < fromRow - 1) {
                throw new PositionOutOfRangeException("Block body rows out of order", fromRow, 0);
            }
            String childIndent = nested ? indent + config.getIndentString() : indent;
            if (original != null) {
                for (Statement s : original) {
                    if (s != null && s.getPosition() != null) {
                        childIndent = index.leadingWhitespace(s.getPosition().getStartRow());
                        break;
                    }
                }
            }
            return terminated(body(original, mutated, fromRow, toRow, childIndent));
        }

        // ============ 工具 ============

        private String lines(int fromRow, int toRow) {
            if (fromRow > toRow) {
                return "";
            }
            return index.lines(fromRow, toRow);
        }

        /** 打印器输出的换行换成原文的换行符 */
        private String withEol(String printed) {
            return "\n".equals(eol) ? printed : LONE_LF.matcher(printed).replaceAll("\r\n");
        }

        /** 独立的诊断列表，用于只比较不输出的打印 */
        private PrintContext scratch(PrintContext at) {
            return PrintContext.create(config).withBasePrefix(at.getBasePrefix());
        }
    }

    /** 原文第一个换行是 \r\n 时返回 \r\n，否则返回 \n */
    static String lineEnding(String source) {
        int lf = source.indexOf('\n');
        return lf > 0 && source.charAt(lf - 1) == '\r' ? "\r\n" : "\n";
    }

    private static void append(StringBuilder out, String text) {
        if (text.isEmpty()) {
            return;
        }
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        out.append(text);
    }

    private static String terminated(String text) {
        return text.isEmpty() || text.endsWith("\n") ? text : text + "\n";
    }

    private static String rtrim(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }

    private static List<String> texts(List<Comment> comments) {
        List<String> result = new ArrayList<String>();
        for (Comment c : comments) {
            if (!c.isDeleted()) result.add(c.getText());
        }
        return result;
    }

    private static boolean sameText(Comment a, Comment b) {
        String ta = a == null || a.isDeleted() ? null : a.getText();
        String tb = b == null || b.isDeleted() ? null : b.getText();
        return ta == null ? tb == null : ta.equals(tb);
    }

    private static CodePosition positionOf(Comment comment) {
        return positionOf(comment.getPosition());
    }

    private static CodePosition positionOf(CodePosition position) {
        if (position == null) {
            throw new PositionOutOfRangeException("Missing position", -1, -1);
        }
        return position;
    }

    private static List<Decorator> decoratorsOf(Statement stmt) {
        if (stmt instanceof DefineStmt) {
            return ((DefineStmt) stmt).getDecorators();
        }
        if (stmt instanceof OnBlockStmt) {
            return ((OnBlockStmt) stmt).getDecorators();
        }
        return Collections.emptyList();
    }

    private static List<Statement> bodyOf(Statement stmt) {
        if (stmt instanceof DefineStmt) return ((DefineStmt) stmt).getBody();
        if (stmt instanceof DoStmt) return ((DoStmt) stmt).getBody();
        if (stmt instanceof TogetherStmt) return ((TogetherStmt) stmt).getBlocks();
        if (stmt instanceof ForLoopStmt) return ((ForLoopStmt) stmt).getBody();
        if (stmt instanceof OnBlockStmt) return ((OnBlockStmt) stmt).getBody();
        if (stmt instanceof CommandStmt && ((CommandStmt) stmt).getCallback() != null) {
            return ((CommandStmt) stmt).getCallback().getBody();
        }
        return Collections.emptyList();
    }
}
