package com.robinpath.cli;

import com.robinpath.compiler.RobinPath;
import com.robinpath.compiler.ast.stmt.CommandStmt;
import com.robinpath.compiler.ast.stmt.Statement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("robinpath 命令行")
class MainTest {

    @TempDir
    Path dir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private Path file(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    private static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("没有子命令时输出帮助")
    void testUsage() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("fmt", "ast", "regen");
    }

    @Nested
    @DisplayName("fmt")
    class FmtTests {

        @Test
        @DisplayName("--check 发现需要格式化时退出码为 1，不写回")
        void testCheckUnformatted() throws IOException {
            Path src = file("a.rp", "log   1");
            assertThat(run("fmt", "--check", src.toString())).isEqualTo(1);
            assertThat(out.toString()).contains("a.rp");
            assertThat(read(src)).isEqualTo("log   1");
        }

        @Test
        @DisplayName("--check 已格式化时退出码为 0")
        void testCheckFormatted() throws IOException {
            Path src = file("b.rp", "log 1\n");
            assertThat(run("fmt", "--check", src.toString())).isZero();
        }

        @Test
        @DisplayName("重写文件")
        void testRewrite() throws IOException {
            Path src = file("c.rp", "def f\n      log 1\nenddef");
            assertThat(run("fmt", "--indent-size", "4", src.toString())).isZero();
            assertThat(read(src)).isEqualTo("def f\n    log 1\nenddef\n");
        }

        @Test
        @DisplayName("语法错误时退出码为 2")
        void testParseError() throws IOException {
            Path src = file("d.rp", "if $x\n  log 1\n");
            assertThat(run("fmt", src.toString())).isEqualTo(2);
            assertThat(err.toString()).contains("d.rp");
        }

        @Test
        @DisplayName("文件不存在时退出码为 2")
        void testMissingFile() {
            assertThat(run("fmt", dir.resolve("missing.rp").toString())).isEqualTo(2);
            assertThat(err.toString()).contains("missing.rp");
        }
    }

    @Nested
    @DisplayName("ast 与 regen")
    class TreeTests {

        @Test
        @DisplayName("ast 输出 JSON 语法树")
        void testAst() throws IOException {
            Path src = file("e.rp", "log \"hello\"\n");
            assertThat(run("ast", src.toString())).isZero();
            assertThat(out.toString()).contains("\"type\":\"command\"", "\"name\":\"log\"");
        }

        @Test
        @DisplayName("regen 用修改后的语法树再生成源码")
        void testRegen() throws IOException {
            String source = "# greet\nlog \"hello\"\n\nlog 2\n";
            Path src = file("f.rp", source);
            List<Statement> tree = RobinPath.parse(source);
            ((CommandStmt) tree.get(0)).setName("print");
            Path json = file("f.json", RobinPath.toJson(tree));

            assertThat(run("regen", src.toString(), "--tree", json.toString())).isZero();
            assertThat(out.toString()).isEqualTo("# greet\nprint \"hello\"\n\nlog 2\n");
        }

        @Test
        @DisplayName("regen 语法树格式错误时退出码为 2")
        void testRegenBadTree() throws IOException {
            Path src = file("g.rp", "log 1\n");
            Path json = file("g.json", "{\"type\":\"command\"}");
            assertThat(run("regen", src.toString(), "--tree", json.toString())).isEqualTo(2);
            assertThat(err.toString()).isNotEmpty();
        }
    }
}
