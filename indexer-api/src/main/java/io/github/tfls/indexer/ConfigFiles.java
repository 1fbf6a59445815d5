package io.github.tfls.indexer;

import java.util.List;
import java.util.Locale;

/** File name rules for configuration documents. */
public final class ConfigFiles {

    public static final List<String> NATIVE_SUFFIXES = List.of(".tf", ".tofu", ".tfvars");
    public static final List<String> JSON_SUFFIXES = List.of(".tf.json", ".tofu.json", ".tfvars.json");

    private ConfigFiles() {}

    public static boolean isConfigFile(String fileName) {
        if (isIgnoredFile(fileName)) {
            return false;
        }
        var lower = fileName.toLowerCase(Locale.ROOT);
        return NATIVE_SUFFIXES.stream().anyMatch(lower::endsWith) || JSON_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    public static boolean isJson(String fileName) {
        var lower = fileName.toLowerCase(Locale.ROOT);
        return JSON_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    /** Variable definition files hold only top-level attributes. */
    public static boolean isVariablesFile(String fileName) {
        var lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".tfvars") || lower.endsWith(".tfvars.json");
    }

    /** Hidden files, editor backups ({@code foo.tf~}) and emacs lock/autosave files ({@code #foo.tf#}). */
    public static boolean isIgnoredFile(String fileName) {
        return fileName.startsWith(".")
                || fileName.endsWith("~")
                || (fileName.startsWith("#") && fileName.endsWith("#"));
    }
}
