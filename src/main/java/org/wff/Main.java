package org.wff;

import org.wff.generator.PlannedProblemGenerator;
import org.wff.parser.FormulaTextParser;
import org.wff.parser.WffChecker;
import org.wff.parser.WffParser;
import org.wff.proof.DerivationReplayer;
import org.wff.proof.Problem;
import org.wff.proof.Proof;
import org.wff.proof.ProofValidator;
import org.wff.proof.ValidationResult;
import org.wff.support.Formula;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Random;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NUCLEO LOGICO DEL TUTOR DI DIMOSTRAZIONI - Interfaccia a riga di comando
 *
 * MODALITÀ OPERATIVE:
 * - Generazione (-gen=<difficoltà> <numero>): genera problemi risolvibili, ne
 *   ricostruisce la dimostrazione dall'albero di derivazione e la valida
 * - Verifica formule (-f <file>): per ogni riga del file indica se la formula
 *   è ben formata e ne mostra la forma normalizzata
 *
 * OPZIONI:
 * - -o <directory>: salva i problemi generati in GENERATED/problem_<n>.txt
 * - -seed <numero>: generazione riproducibile
 * - -v: log dettagliati (livello FINE) per il package org.wff
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String OUTPUT_PARAM = "-o";
    private static final String SEED_PARAM = "-seed";
    private static final String VERBOSE_PARAM = "-v";
    private static final String GEN_PARAM = "-gen=";

    private static final int MIN_DIFFICULTY = 1;
    private static final int MAX_DIFFICULTY = 10;
    private static final int MIN_PROBLEMS = 1;
    private static final int MAX_PROBLEMS = 100;

    private static final String GENERATED_DIR = "GENERATED";
    private static final String PROBLEM_GROUP = "Problemi generati";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        System.out.println("---> AVVIO NUCLEO LOGICO WFF <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            configureLogging(config.verbose);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE <---");
        }
    }

    private static void executeMainPipeline(CliConfiguration config) throws IOException {
        if (config.isGenerationMode) {
            System.out.println("[I] Modalità: Generazione di " + config.problemCount
                    + " problemi a difficoltà " + config.difficulty);
            processProblemGeneration(config);
        } else {
            System.out.println("[I] Modalità: Verifica formule da " + config.inputPath);
            processFormulaFile(config);
        }
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.exit(1);
    }

    /**
     * Livello WARNING per impostazione predefinita, FINE per org.wff con -v.
     */
    private static void configureLogging(boolean verbose) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.WARNING);
        if (!verbose) return;

        Logger packageLogger = Logger.getLogger("org.wff");
        packageLogger.setLevel(Level.FINE);
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        packageLogger.addHandler(handler);
        packageLogger.setUseParentHandlers(false);
    }

    //endregion

    //region GENERAZIONE PROBLEMI

    private static void processProblemGeneration(CliConfiguration config) {
        PlannedProblemGenerator generator = config.seed != null
                ? new PlannedProblemGenerator(new Random(config.seed))
                : new PlannedProblemGenerator();
        ProofValidator validator = new ProofValidator();

        int written = 0;
        for (int n = 1; n <= config.problemCount; n++) {
            Problem problem = generator.generate(config.difficulty);
            if (problem == null) {
                System.out.println("[W] Problema " + n + ": nessun problema valido trovato, provare una difficoltà minore");
                continue;
            }

            Proof proof = DerivationReplayer.replay(problem);
            ValidationResult result = validator.checkSolution(problem, proof);

            System.out.println("\n[I] Problema " + n + " (" + problem.getId() + ", difficoltà " + problem.getDifficulty() + ")");
            for (Formula premise : problem.getPremises()) {
                System.out.println("    Premessa:  " + premise);
            }
            System.out.println("    Obiettivo: " + problem.getConclusion());
            System.out.print(proof.toString().indent(4));
            System.out.println("    Verifica:  " + result);

            if (config.outputPath != null) {
                writeProblemFile(config.outputPath, problem, n);
                written++;
            }
        }

        System.out.println();
        System.out.print(generator.getStatistics());
        if (config.outputPath != null) {
            System.out.println("[I] File scritti in " + Paths.get(config.outputPath, GENERATED_DIR) + ": " + written);
        }
    }

    private static void writeProblemFile(String outputPath, Problem problem, int index) {
        Path directory = Paths.get(outputPath, GENERATED_DIR);
        Path file = directory.resolve("problem_" + index + ".txt");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, ProblemTextFormatter.format(PROBLEM_GROUP, List.of(problem)));
            LOGGER.fine("Problema salvato: " + file);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Errore durante il salvataggio di " + file, e);
            throw new RuntimeException("Impossibile scrivere il problema " + index, e);
        }
    }

    //endregion

    //region VERIFICA FORMULE

    private static void processFormulaFile(CliConfiguration config) throws IOException {
        List<String> lines = Files.readAllLines(Path.of(config.inputPath));
        FormulaTextParser textParser = new FormulaTextParser();

        int checked = 0;
        int accepted = 0;
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).trim();
            if (text.isEmpty() || text.startsWith("#")) continue;
            checked++;

            Formula formula = textParser.toFormula(text);
            if (formula == null) {
                System.out.println("[E] Riga " + (i + 1) + ": simboli non riconosciuti (" + textParser.getLastErrorMessage() + ")");
                continue;
            }

            if (WffChecker.isWff(formula)) {
                accepted++;
                System.out.println("[I] Riga " + (i + 1) + ": WFF        " + WffParser.normalize(formula));
            } else {
                textParser.parse(text);
                System.out.println("[I] Riga " + (i + 1) + ": NON WFF    " + formula
                        + " (" + textParser.getLastErrorMessage() + ")");
            }
        }
        System.out.println("\n[I] Formule verificate: " + checked + ", ben formate: " + accepted);
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void printApplicationHelp() {
        System.out.println("\n::>> NUCLEO LOGICO WFF <<::");
        System.out.println("Generatore e verificatore di dimostrazioni in logica proposizionale\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar wff-logic-core.jar [opzioni]\n");

        System.out.println("MODALITÀ OPERATIVE:");
        System.out.println("  1. GENERAZIONE PROBLEMI:");
        System.out.println("     -gen=<difficoltà> <numero>  Genera problemi (difficoltà 1-10, numero 1-100)");
        System.out.println("     -o <directory>              Salva i problemi in <directory>/GENERATED");
        System.out.println("     -seed <numero>              Seme per generazione riproducibile");
        System.out.println();
        System.out.println("  2. VERIFICA FORMULE:");
        System.out.println("     -f <file>                   Una formula per riga, righe '#' ignorate");
        System.out.println();
        System.out.println("  3. ALTRO:");
        System.out.println("     -v                          Log dettagliati");
        System.out.println("     -h                          Mostra questa guida\n");

        System.out.println("SIMBOLI ACCETTATI:");
        System.out.println("  ¬ ~ !   negazione");
        System.out.println("  ∧ &     congiunzione");
        System.out.println("  ∨ |     disgiunzione");
        System.out.println("  → ->    implicazione");
        System.out.println("  ↔ <->   biimplicazione");
        System.out.println("  a-z A-Z variabili\n");
    }

    /**
     * Configurazione immutabile prodotta dall'{@link ArgumentParser}.
     */
    private static class CliConfiguration {
        final boolean isGenerationMode;
        final int difficulty;
        final int problemCount;
        final String inputPath;
        final String outputPath;
        final Long seed;
        final boolean verbose;

        CliConfiguration(boolean isGenerationMode, int difficulty, int problemCount,
                         String inputPath, String outputPath, Long seed, boolean verbose) {
            this.isGenerationMode = isGenerationMode;
            this.difficulty = difficulty;
            this.problemCount = problemCount;
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.seed = seed;
            this.verbose = verbose;
        }
    }

    private static class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException per parametri sconosciuti, mancanti o in conflitto
         */
        public CliConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            Long seed = null;
            boolean verbose = false;
            GenerationConfig generation = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        if (generation != null) throw exclusiveModes();
                        inputPath = getNextArgument(args, ++i, "file");
                        if (!Files.isRegularFile(Path.of(inputPath))) {
                            throw new IllegalArgumentException("File non trovato: " + inputPath);
                        }
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");
                    case SEED_PARAM -> seed = parseLong(getNextArgument(args, ++i, "seme"));
                    case VERBOSE_PARAM -> verbose = true;
                    default -> {
                        if (args[i].startsWith(GEN_PARAM)) {
                            if (inputPath != null) throw exclusiveModes();
                            generation = parseGenerationParameters(args, i);
                            i = generation.nextIndex;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (generation == null && inputPath == null) {
                throw new IllegalArgumentException("Specificare una modalità: -gen=<difficoltà> <numero> oppure -f <file>");
            }
            if (generation == null && outputPath != null) {
                throw new IllegalArgumentException("Il parametro -o è ammesso solo in modalità generazione");
            }

            return generation != null
                    ? new CliConfiguration(true, generation.difficulty, generation.count, null, outputPath, seed, verbose)
                    : new CliConfiguration(false, 0, 0, inputPath, null, seed, verbose);
        }

        private GenerationConfig parseGenerationParameters(String[] args, int currentIndex) {
            int difficulty = parseInt(args[currentIndex].substring(GEN_PARAM.length()), "Difficoltà");
            if (difficulty < MIN_DIFFICULTY || difficulty > MAX_DIFFICULTY) {
                throw new IllegalArgumentException("Difficoltà deve essere tra " + MIN_DIFFICULTY + " e "
                        + MAX_DIFFICULTY + ", ricevuto: " + difficulty);
            }

            int count = parseInt(getNextArgument(args, currentIndex + 1, "numero problemi"), "Numero problemi");
            if (count < MIN_PROBLEMS || count > MAX_PROBLEMS) {
                throw new IllegalArgumentException("Numero problemi deve essere tra " + MIN_PROBLEMS + " e "
                        + MAX_PROBLEMS + ", ricevuto: " + count);
            }
            return new GenerationConfig(difficulty, count, currentIndex + 1);
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + description);
            }
            return args[index];
        }

        private int parseInt(String value, String description) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(description + " non valido: " + value);
            }
        }

        private long parseLong(String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }

        private IllegalArgumentException exclusiveModes() {
            return new IllegalArgumentException("Generazione (-gen) e verifica formule (-f) sono mutualmente esclusive");
        }
    }

    /** Parametri di -gen e indice dell'ultimo argomento consumato */
    private static class GenerationConfig {
        final int difficulty;
        final int count;
        final int nextIndex;

        GenerationConfig(int difficulty, int count, int nextIndex) {
            this.difficulty = difficulty;
            this.count = count;
            this.nextIndex = nextIndex;
        }
    }

    //endregion
}
