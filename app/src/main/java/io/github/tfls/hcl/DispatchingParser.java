package io.github.tfls.hcl;

import io.github.tfls.indexer.ConfigFiles;
import io.github.tfls.indexer.DocumentId;
import io.github.tfls.indexer.ParseResult;
import io.github.tfls.indexer.Parser;

/** Chooses the native or JSON parser from the document's file name. */
public final class DispatchingParser implements Parser {
    private final Parser nativeParser;
    private final Parser jsonParser;

    public DispatchingParser() {
        this(new HclParser(), new JsonConfigParser());
    }

    public DispatchingParser(Parser nativeParser, Parser jsonParser) {
        this.nativeParser = nativeParser;
        this.jsonParser = jsonParser;
    }

    @Override
    public ParseResult parse(DocumentId document, String content) {
        var parser = ConfigFiles.isJson(document.getFileName()) ? jsonParser : nativeParser;
        return parser.parse(document, content);
    }
}
