package com.debugpro.cli;

import debugpro.runtime.Frames;
import debugpro.runtime.report.CrashReporter;
import debugpro.runtime.report.DebugPro;
import debugpro.runtime.report.DebugProConfig;
import debugpro.runtime.report.Report;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * DebugPro CLI 入口（picocli）：安装处理器并触发一个演示场景。
 *
 * <p>只用 picocli 解析参数，场景在 {@code main} 线程上直接执行，
 * 这样异常才能真正未被捕获并到达处理器。</p>
 */
@Command(name = "debugpro", version = "DebugPro v0.1.0",
         mixinStandardHelpOptions = true,
         description = "触发一个失败场景，展示诊断报告")
public class Main {

    @Parameters(index = "0", description = "场景: ${COMPLETION-CANDIDATES}")
    Scenario scenario;

    @Option(names = "--no-color", description = "关闭 ANSI 颜色")
    boolean noColor;

    @Option(names = "--source-root", description = "源码根目录（可重复）")
    List<Path> sourceRoots;

    @Option(names = "--dry-run", description = "只渲染报告，不安装处理器")
    boolean dryRun;

    public static void main(String[] args) throws Exception {
        Main main = new Main();
        CommandLine cmd = new CommandLine(main);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        try {
            CommandLine.ParseResult parsed = cmd.parseArgs(args);
            if (CommandLine.printHelpIfRequested(parsed)) {
                return;
            }
        } catch (CommandLine.ParameterException e) {
            System.err.println("错误: " + e.getMessage());
            e.getCommandLine().usage(System.err);
            System.exit(2);
        }
        main.launch(System.out);
    }

    DebugProConfig toConfig() {
        DebugProConfig.Builder builder = DebugProConfig.fromSystemProperties().toBuilder();
        if (sourceRoots != null && !sourceRoots.isEmpty()) {
            builder.clearSourceRoots();
            for (Path root : sourceRoots) {
                builder.sourceRoot(root);
            }
        }
        if (noColor) {
            builder.color(false);
        }
        return builder.build();
    }

    void launch(PrintStream out) throws Exception {
        DebugProConfig config = toConfig();
        if (dryRun) {
            out.print(renderScenario(config));
            return;
        }
        DebugPro.install(config, out, System.err);
        trigger();
    }

    String renderScenario(DebugProConfig config) {
        try {
            trigger();
        } catch (Exception e) {
            Report report = new CrashReporter(config).analyze(e);
            return report != null ? report.getText() : "no application frames in " + e + "\n";
        }
        return "scenario " + scenario + " completed without error\n";
    }

    private void trigger() throws Exception {
        Frames.run("launch", locals -> {
            locals.bind("scenario", scenario);
            scenario.trigger();
        });
    }
}
