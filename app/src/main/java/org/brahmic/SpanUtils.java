package org.brahmic;

import java.util.*;

public class SpanUtils {
    static final int TAB_WIDTH = 8;

    // Returns (line, column), both 1-based.
    //
    // `lineIndex` holds the offsets after which each line begins, starting
    // with 0 for the first line.
    public static Position locate(int numChar, List<Integer> lineIndex) {
        var lineFind = Collections.binarySearch(lineIndex, numChar);

        int linePos;
        if (lineFind >= 0) {
            // exactly on a line break, it still belongs to the line it ends
            linePos = lineFind;
        } else {
            // binarySearch returns (-(insertion_point) - 1) so we reverse that
            linePos = -(lineFind + 1);
        }
        if (linePos == 0) {
            linePos = 1;
        }

        var charPos = numChar - lineIndex.get(linePos - 1);

        return new Position(linePos, charPos);
    }

    public static int lineAt(int numChar, List<Integer> lineIndex) {
        return SpanUtils.locate(numChar, lineIndex).line();
    }

    // Text of a 1-based line, without its line break
    public static String lineText(String source, int line, List<Integer> lineIndex) {
        if (line < 1 || line > lineIndex.size()) {
            return "";
        }
        int from = lineIndex.get(line - 1);
        int to = line < lineIndex.size() ? lineIndex.get(line) - 1 : source.length();
        return source.substring(from, Math.max(from, to));
    }

    // Leading whitespace width, tabs count as TAB_WIDTH columns
    public static int indentOf(String line) {
        int indent = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') {
                indent += 1;
            } else if (c == '\t') {
                indent += TAB_WIDTH;
            } else {
                break;
            }
        }
        return indent;
    }
}
