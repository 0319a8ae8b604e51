package com.stopengine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stopengine.config.Constants;
import com.stopengine.config.StopwordConfig;
import com.stopengine.error.StopwordException;
import com.stopengine.resource.MetadataDocument;
import com.stopengine.resource.ResourceEntry;
import com.stopengine.resource.ResourceGraphResolver;
import com.stopengine.resource.WordFileLoader;
import com.stopengine.stopword.ExportFormat;
import com.stopengine.stopword.StopwordFilter;
import com.stopengine.stopword.StopwordManager;
import com.stopengine.stopword.Stopwords;
import com.stopengine.text.Token;
import com.stopengine.text.WordTokenizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "stopwords",
    description = "🧹 可继承停用词资源管理工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ListSubcommand.class,
        MainCommand.CheckSubcommand.class,
        MainCommand.FilterSubcommand.class,
        MainCommand.ExportSubcommand.class,
        MainCommand.ResourcesSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--metadata"}, description = "元数据文件路径（默认使用内置资源）")
    private Path metadataPath;

    @Option(names = {"--case-sensitive"}, description = "区分大小写匹配", defaultValue = "false")
    private boolean caseSensitive;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🧹 可继承停用词资源管理工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private Stopwords openStopwords() {
        StopwordConfig config = StopwordConfig.fromEnvironment();
        if (metadataPath != null) {
            config.setMetadataPath(metadataPath);
        }
        config.setCaseSensitive(caseSensitive);
        return Stopwords.fromConfig(config, new ResourceGraphResolver());
    }

    private static List<String> resourcesOrDefault(List<String> resources, Stopwords stopwords) {
        return resources == null || resources.isEmpty() ? List.of(stopwords.getDefaultResource()) : resources;
    }

    private static int fail(String action, StopwordException exception) {
        System.err.println("❌ " + action + "失败: " + exception.getMessage());
        return 1;
    }

    @Command(name = "list", description = "📋 列出资源中的停用词（已排序）")
    static class ListSubcommand implements Callable<Integer> {

        @Option(names = {"-r", "--resource"}, description = "资源名（可指定多个，默认 " + Constants.DEFAULT_RESOURCE + "）")
        private List<String> resources;

        @Option(names = {"-f", "--format"}, description = "输出格式 (txt|json)", defaultValue = "txt")
        private String format;

        @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
        private Path output;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ExportFormat exportFormat = ExportFormat.parse(format);
                Stopwords stopwords = main.openStopwords();
                List<String> words = stopwords.listStopwords(
                    resourcesOrDefault(resources, stopwords), main.caseSensitive, true);
                String rendered = render(words, exportFormat);
                if (output != null) {
                    Files.writeString(output, rendered, StandardCharsets.UTF_8);
                    System.out.println("✅ 停用词已写入 " + output);
                } else {
                    System.out.println(rendered);
                }
                return 0;
            } catch (StopwordException exception) {
                return fail("列出停用词", exception);
            } catch (IOException exception) {
                System.err.println("❌ 写入输出失败: " + exception.getMessage());
                return 1;
            }
        }

        private String render(List<String> words, ExportFormat exportFormat) throws IOException {
            if (exportFormat == ExportFormat.JSON) {
                return new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(words);
            }
            return String.join("\n", words);
        }
    }

    @Command(name = "check", description = "🔎 判断单词是否为停用词")
    static class CheckSubcommand implements Callable<Integer> {

        @Parameters(description = "待判断的单词", arity = "1..*")
        private List<String> tokens;

        @Option(names = {"-r", "--resource"}, description = "资源名（可指定多个）")
        private List<String> resources;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Stopwords stopwords = main.openStopwords();
                for (String token : tokens) {
                    boolean stopword = stopwords.isStopword(token, resources, main.caseSensitive);
                    System.out.println(token + "\t" + stopword);
                }
                return 0;
            } catch (StopwordException exception) {
                return fail("判断停用词", exception);
            }
        }
    }

    @Command(name = "filter", description = "✂️ 分词并移除停用词")
    static class FilterSubcommand implements Callable<Integer> {

        @Parameters(description = "待处理文本", arity = "1")
        private String text;

        @Option(names = {"-r", "--resource"}, description = "资源名（可指定多个）")
        private List<String> resources;

        @Option(names = {"--add"}, description = "额外停用词")
        private List<String> additions;

        @Option(names = {"--keep"}, description = "保留词（永不视为停用词）")
        private List<String> keep;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                Stopwords stopwords = main.openStopwords();
                StopwordManager manager = StopwordManager.fromResources(
                    stopwords, resources, additions, keep, main.caseSensitive);
                List<Token> tokens = new WordTokenizer().tokenize(text);
                List<String> kept = new StopwordFilter(manager).filterTerms(tokens);
                System.out.println(String.join(" ", kept));
                return 0;
            } catch (StopwordException exception) {
                return fail("过滤文本", exception);
            }
        }
    }

    @Command(name = "export", description = "💾 导出定制后的停用词集合")
    static class ExportSubcommand implements Callable<Integer> {

        @Option(names = {"-o", "--output"}, description = "输出文件", required = true)
        private Path output;

        @Option(names = {"-f", "--format"}, description = "导出格式 (txt|json)", defaultValue = "txt")
        private String format;

        @Option(names = {"-r", "--resource"}, description = "基础资源名（可指定多个）")
        private List<String> resources;

        @Option(names = {"--add-file"}, description = "额外停用词文件（可指定多个）")
        private List<Path> additionFiles;

        @Option(names = {"--keep-file"}, description = "保留词文件（可指定多个）")
        private List<Path> keepFiles;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ExportFormat exportFormat = ExportFormat.parse(format);
                Stopwords stopwords = main.openStopwords();
                StopwordManager manager = StopwordManager.fromResources(
                    stopwords, resources, null, null, main.caseSensitive);
                if (additionFiles != null) {
                    for (Path additionFile : additionFiles) {
                        manager.loadAdditions(additionFile);
                    }
                }
                if (keepFiles != null) {
                    for (Path keepFile : keepFiles) {
                        manager.addKeepWords(WordFileLoader.load(keepFile, main.caseSensitive));
                    }
                }
                manager.export(output, exportFormat);
                System.out.println("✅ 已导出 " + manager.stopwords().size() + " 个停用词到 " + output);
                return 0;
            } catch (StopwordException exception) {
                return fail("导出", exception);
            }
        }
    }

    @Command(name = "resources", description = "📚 列出元数据中声明的资源")
    static class ResourcesSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                MetadataDocument document = main.openStopwords().metadata();
                for (ResourceEntry entry : document.sets().values()) {
                    System.out.println(describe(entry));
                }
                return 0;
            } catch (StopwordException exception) {
                return fail("读取元数据", exception);
            }
        }

        private String describe(ResourceEntry entry) {
            List<String> parts = new ArrayList<>();
            if (entry.isAlias()) {
                parts.add("-> " + entry.alias());
            }
            if (!entry.extendsNames().isEmpty()) {
                parts.add("extends " + String.join(", ", entry.extendsNames()));
            }
            if (entry.description() != null) {
                parts.add(entry.description());
            }
            return parts.isEmpty() ? entry.name() : entry.name() + "\t" + String.join(" | ", parts);
        }
    }
}
