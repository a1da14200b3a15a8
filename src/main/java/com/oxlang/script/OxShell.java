package com.oxlang.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import com.oxlang.debug.Debug;
import com.oxlang.script.parser.Value;
import com.oxlang.script.plugins.OxCorePlugin;

/**
 * Line-oriented interactive shell over one persistent engine.
 *
 * Input is buffered until brackets balance, so a multi-line function can be
 * typed naturally; the continuation prompt is shown meanwhile. Each chunk is
 * run and its value echoed (nothing for nil). Errors print their message and
 * leave the session usable.
 */
public final class OxShell {
    public static final String PROMPT = "ox> ";
    public static final String CONTINUATION = "--> ";

    private final OxScript engine;
    private final BufferedReader in;
    private final PrintWriter out;

    public OxShell(OxScript engine, Reader in, Writer out) {
        if (engine == null) throw new IllegalArgumentException("engine is null");
        this.engine = engine;
        this.in = (in instanceof BufferedReader) ? (BufferedReader) in : new BufferedReader(in);
        this.out = (out instanceof PrintWriter) ? (PrintWriter) out : new PrintWriter(out, true);
    }

    public static void main(String[] args) throws IOException {
        PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        if (args.length > 0 && "--debug".equals(args[0])) {
            Debug.useSysOut();
        }
        OxScript engine = new OxScript(EngineConfig.load());
        OxCorePlugin.register(engine, out);
        new OxShell(engine, new InputStreamReader(System.in, StandardCharsets.UTF_8), out).run();
    }

    /** Reads until end of input; returns the number of chunks that failed. */
    public int run() throws IOException {
        int failures = 0;
        StringBuilder pending = new StringBuilder();

        out.print(PROMPT);
        out.flush();

        String line;
        while ((line = in.readLine()) != null) {
            pending.append(line).append('\n');
            if (depth(pending) > 0) {
                out.print(CONTINUATION);
                out.flush();
                continue;
            }

            String chunk = pending.toString();
            pending.setLength(0);
            if (!chunk.isBlank() && !evaluate(chunk)) failures++;

            out.print(PROMPT);
            out.flush();
        }

        if (pending.length() > 0 && !pending.toString().isBlank() && !evaluate(pending.toString())) {
            failures++;
        }
        out.println();
        out.flush();
        return failures;
    }

    private boolean evaluate(String chunk) {
        try {
            Value v = engine.eval(chunk);
            if (!v.isNil()) out.println(v.display());
            return true;
        } catch (OxError e) {
            out.println(e.getMessage());
            return false;
        } finally {
            out.flush();
        }
    }

    /** Open-bracket count of {@code src}, ignoring strings and line comments. */
    static int depth(CharSequence src) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < src.length(); i++) {
            char c = src.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '"':
                case '\'':
                    quote = c;
                    break;
                case '/':
                    if (i + 1 < src.length() && src.charAt(i + 1) == '/') {
                        while (i < src.length() && src.charAt(i) != '\n') i++;
                    }
                    break;
                case '(': case '[': case '{':
                    depth++;
                    break;
                case ')': case ']': case '}':
                    depth--;
                    break;
                default:
                    break;
            }
        }
        return depth;
    }
}
