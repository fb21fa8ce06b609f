package com.kilnlang.worker.options;

import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * 把一个请求的参数解析为 {@link WorkerOptions}。
 *
 * <p>picocli 自带的 {@code @file} 展开被关闭，参数文件由
 * {@link com.kilnlang.worker.args.ArgumentExpander} 统一处理。</p>
 */
public class OptionsParser {
    private final URI workingDirectory;

    public OptionsParser(Path workingDirectory) {
        String uri = workingDirectory.toAbsolutePath().toUri().toString();
        this.workingDirectory = URI.create(uri.endsWith("/") ? uri : uri + "/");
    }

    public URI getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * @throws OptionParseException 未知选项、选项值非法或缺少必需选项
     */
    public WorkerOptions parse(List<String> args) throws OptionParseException {
        WorkerOptions options = new WorkerOptions();
        CommandLine cmd = newCommandLine(options);
        try {
            cmd.parseArgs(args.toArray(new String[0]));
        } catch (CommandLine.ParameterException e) {
            throw new OptionParseException(e.getMessage(), e);
        }
        if (options.isHelp()) {
            return options;
        }

        if (options.platformSummary == null) {
            throw new OptionParseException("Missing required option: '--platform-summary'");
        }
        if (options.output == null) {
            throw new OptionParseException("Missing required option: '--output'");
        }
        if (options.sources.isEmpty()) {
            throw new OptionParseException("At least one '--source' is required");
        }
        options.resolveAgainst(workingDirectory);
        return options;
    }

    /** 帮助文本（无 ANSI 颜色） */
    public static String usage() {
        return newCommandLine(new WorkerOptions()).getUsageMessage(CommandLine.Help.Ansi.OFF);
    }

    private static CommandLine newCommandLine(WorkerOptions options) {
        CommandLine cmd = new CommandLine(options);
        cmd.setExpandAtFiles(false);
        return cmd;
    }
}
