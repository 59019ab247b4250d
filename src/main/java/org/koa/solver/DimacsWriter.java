package org.koa.solver;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Esportazione di una CnfFormula nel formato DIMACS standard.
 *
 * STRUTTURA DEL FILE:
 * • righe di commento iniziali "c ..."
 * • header "p cnf &lt;variabili&gt; &lt;clausole&gt;"
 * • una clausola per riga, letterali separati da spazio e terminata da 0
 */
public final class DimacsWriter {

    private static final Logger LOGGER = Logger.getLogger(DimacsWriter.class.getName());

    private static final String COMMENT_PREFIX = "c ";
    private static final String PROBLEM_PREFIX = "p cnf";
    private static final String CLAUSE_TERMINATOR = "0";

    private DimacsWriter() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static void write(CnfFormula cnf, List<String> comments, Writer writer) throws IOException {
        Objects.requireNonNull(cnf, "Formula CNF non può essere null");
        Objects.requireNonNull(writer, "Writer non può essere null");

        for (String comment : comments) {
            writer.write(COMMENT_PREFIX + comment + "\n");
        }
        writer.write(PROBLEM_PREFIX + " " + cnf.getVariableCount() + " " + cnf.getClauseCount() + "\n");

        StringBuilder line = new StringBuilder();
        for (int[] clause : cnf.getClauses()) {
            line.setLength(0);
            for (int literal : clause) {
                line.append(literal).append(' ');
            }
            line.append(CLAUSE_TERMINATOR).append('\n');
            writer.write(line.toString());
        }
        writer.flush();
    }

    /**
     * Scrive il file creando le directory mancanti.
     */
    public static void write(CnfFormula cnf, List<String> comments, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(cnf, comments, writer);
        }
        LOGGER.fine("CNF esportata in " + path + ": " + cnf.getClauseCount() + " clausole");
    }

    public static String toDimacs(CnfFormula cnf, List<String> comments) {
        StringWriter writer = new StringWriter();
        try {
            write(cnf, comments, writer);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return writer.toString();
    }
}
