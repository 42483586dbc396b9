package work.lcod.uber.merge;

import java.util.LinkedHashMap;
import java.util.Map;
import us.bpsm.edn.EdnException;
import us.bpsm.edn.parser.Parseable;
import us.bpsm.edn.parser.Parser;
import us.bpsm.edn.parser.Parsers;
import us.bpsm.edn.printer.Printers;
import work.lcod.uber.shared.UberException;

/**
 * Merges EDN reader descriptors ({@code data_readers.clj(c)}): tag symbol to reader function.
 */
public final class ReaderDescriptors {
    private ReaderDescriptors() {}

    /**
     * Merges {@code incoming} into {@code existing}; keys of {@code incoming} win on collision.
     * The result is printed back as EDN.
     */
    public static String merge(String existing, String incoming, String entryName) {
        Map<Object, Object> merged = new LinkedHashMap<>(parse(existing, entryName));
        merged.putAll(parse(incoming, entryName));
        return Printers.printString(merged) + "\n";
    }

    /**
     * Parses EDN text into a map; blank text is an empty map.
     */
    public static Map<?, ?> parse(String text, String entryName) {
        Object value;
        try {
            Parser parser = Parsers.newParser(Parsers.defaultConfiguration());
            Parseable parseable = Parsers.newParseable(text);
            value = parser.nextValue(parseable);
        } catch (EdnException ex) {
            throw new UberException(UberException.READER_PARSE, "Unable to parse " + entryName + ": " + ex.getMessage(), ex);
        }
        if (value == Parser.END_OF_INPUT || value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new UberException(UberException.READER_PARSE, entryName + " must contain an EDN map");
        }
        return map;
    }
}
