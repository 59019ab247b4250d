package org.koa.samples;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.koa.antlr.SampleFileBaseVisitor;
import org.koa.antlr.SampleFileLexer;
import org.koa.antlr.SampleFileParser;
import org.koa.antlr.SampleFileParser.FileContext;
import org.koa.antlr.SampleFileParser.LineContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * LETTORE DI ESEMPI - Da file di testo a SampleSet tramite grammatica ANTLR
 *
 * FORMATO:
 * • un esempio per riga, simboli separati da virgola (es. "a,b,b")
 * • terminatori di riga \n oppure \r\n
 * • una riga vuota rappresenta la stringa vuota
 * • il terminatore finale non crea un esempio aggiuntivo
 *
 * Gli errori lessicali e sintattici diventano IllegalArgumentException con riga e colonna.
 */
public final class SampleReader {

    private static final Logger LOGGER = Logger.getLogger(SampleReader.class.getName());

    private SampleReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @throws IOException se il file non esiste o non è leggibile
     * @throws IllegalArgumentException se il contenuto è malformato
     */
    public static SampleSet read(Path path) throws IOException {
        Objects.requireNonNull(path, "Percorso non può essere null");
        if (!Files.exists(path)) {
            throw new IOException("File non esistente: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("File non leggibile: " + path);
        }
        SampleSet result = parse(CharStreams.fromPath(path, StandardCharsets.UTF_8));
        LOGGER.fine("Letti " + result.size() + " esempi da " + path + ", alfabeto " + result.getAlphabet());
        return result;
    }

    public static SampleSet parse(String text) {
        Objects.requireNonNull(text, "Testo non può essere null");
        return parse(CharStreams.fromString(text));
    }

    private static SampleSet parse(CharStream input) {
        SampleFileLexer lexer = new SampleFileLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailingErrorListener.INSTANCE);

        SampleFileParser parser = new SampleFileParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailingErrorListener.INSTANCE);

        ParseTree tree = parser.file();
        SampleCollector collector = new SampleCollector();
        collector.visit(tree);

        return new SampleSet(collector.samples, new ArrayList<>(collector.alphabet));
    }

    /**
     * Raccoglie gli esempi nell'ordine del file. Un NEWLINE non preceduto da una
     * riga chiude una stringa vuota.
     */
    private static final class SampleCollector extends SampleFileBaseVisitor<Void> {

        private final List<List<String>> samples = new ArrayList<>();
        private final TreeSet<String> alphabet = new TreeSet<>();

        @Override
        public Void visitFile(FileContext ctx) {
            boolean lineOpen = false;
            for (ParseTree child : ctx.children) {
                if (child instanceof LineContext) {
                    visitLine((LineContext) child);
                    lineOpen = true;
                } else if (child instanceof TerminalNode
                        && ((TerminalNode) child).getSymbol().getType() == SampleFileLexer.NEWLINE) {
                    if (!lineOpen) {
                        samples.add(List.of());
                    }
                    lineOpen = false;
                }
            }
            return null;
        }

        @Override
        public Void visitLine(LineContext ctx) {
            List<String> sample = new ArrayList<>();
            for (TerminalNode symbol : ctx.SYMBOL()) {
                sample.add(symbol.getText());
            }
            alphabet.addAll(sample);
            samples.add(sample);
            return null;
        }
    }

    private static final class FailingErrorListener extends BaseErrorListener {

        static final FailingErrorListener INSTANCE = new FailingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new IllegalArgumentException("File di esempi malformato alla riga " + line
                    + ", colonna " + charPositionInLine + ": " + msg, e);
        }
    }
}
