package io.github.tfls.indexer;

/** A {@code module "name" { source = "..." }} reference found while decoding. */
public record ModuleCall(String name, String source, SourceRange range) {

    /** Local sources are filesystem paths relative to the calling document's directory. */
    public boolean isLocal() {
        return source.startsWith("./") || source.startsWith("../") || source.equals(".") || source.equals("..");
    }
}
