package com.robinpath.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;

/**
 * RobinPath CLI 入口点（picocli）
 */
@Command(name = "robinpath", version = "RobinPath v0.1.0",
         mixinStandardHelpOptions = true,
         subcommands = {FmtCommand.class, AstCommand.class, RegenCommand.class})
public class Main implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        // 没有子命令时输出帮助
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，按操作系统原生编码输出中文
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * native.encoding 属性（Java 17+）反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
