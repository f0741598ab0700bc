package in.papertick.infrastructure.provider;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes A-share symbol spellings to the quote endpoint's secid.
 *
 * Accepted forms:
 * - 600000.SH / 000001.SZ
 * - SH600000 / sz000001
 * - 600000 / 000001 (leading 6 → Shanghai, anything else → Shenzhen)
 */
public final class SymbolCodes {

    public static final int MARKET_SHANGHAI = 1;
    public static final int MARKET_SHENZHEN = 0;

    private static final Pattern CODE = Pattern.compile("\\d{6}");

    private SymbolCodes() {}

    /**
     * Market-qualified code. {@link #asParam()} gives the {@code market.code} query form.
     */
    public record SecId(int market, String code) {
        public String asParam() {
            return market + "." + code;
        }

        public String canonical() {
            return code + (market == MARKET_SHANGHAI ? ".SH" : ".SZ");
        }
    }

    public static SecId parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Symbol is null");
        }
        String s = symbol.trim().toUpperCase(Locale.ROOT);

        if (s.length() == 8 && (s.startsWith("SH") || s.startsWith("SZ")) && CODE.matcher(s.substring(2)).matches()) {
            return new SecId(s.startsWith("SH") ? MARKET_SHANGHAI : MARKET_SHENZHEN, s.substring(2));
        }
        if (s.length() == 9 && (s.endsWith(".SH") || s.endsWith(".SZ")) && CODE.matcher(s.substring(0, 6)).matches()) {
            return new SecId(s.endsWith(".SH") ? MARKET_SHANGHAI : MARKET_SHENZHEN, s.substring(0, 6));
        }
        if (CODE.matcher(s).matches()) {
            return new SecId(s.startsWith("6") ? MARKET_SHANGHAI : MARKET_SHENZHEN, s);
        }
        throw new IllegalArgumentException("Unsupported A-share symbol format: " + symbol);
    }

    public static String canonical(String symbol) {
        return parse(symbol).canonical();
    }
}
