package com.raditha.jarl.document;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the executable R chunks of R Markdown and Quarto documents.
 * <p>
 * Only {@code ```{r ...}} fences open a chunk; display blocks such as
 * {@code ```r} and tilde fences are skipped. A chunk is closed by a line
 * holding exactly the opening backticks. Unclosed chunks are dropped.
 */
public class RmdChunkExtractor {

    private static final Pattern OPEN_FENCE = Pattern.compile("^[ \\t]*(`{3,})\\{[rR][^}]*\\}");

    /**
     * True for {@code .Rmd}, {@code .rmd} and {@code .qmd} files.
     */
    public static boolean isDocument(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".rmd") || name.endsWith(".qmd");
    }

    public List<CodeChunk> extract(String content) {
        List<CodeChunk> chunks = new ArrayList<>();
        int offset = 0;
        String fence = null;
        StringBuilder code = null;
        int chunkStart = 0;

        for (String line : splitInclusive(content)) {
            if (fence != null) {
                if (line.strip().equals(fence)) {
                    chunks.add(new CodeChunk(code.toString(), chunkStart));
                    fence = null;
                    code = null;
                } else {
                    code.append(line);
                }
            } else {
                Matcher m = OPEN_FENCE.matcher(line);
                if (m.find()) {
                    fence = m.group(1);
                    code = new StringBuilder();
                    chunkStart = offset + line.length();
                }
            }
            offset += line.length();
        }
        return chunks;
    }

    /**
     * Lines with their terminating newline kept, so lengths add up to
     * document offsets.
     */
    static List<String> splitInclusive(String content) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length()) {
            lines.add(content.substring(start));
        }
        return lines;
    }
}
