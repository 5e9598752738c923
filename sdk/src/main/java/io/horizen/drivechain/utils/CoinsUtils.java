package io.horizen.drivechain.utils;

public final class CoinsUtils {
    private CoinsUtils() {}

    public static final long COIN = 100000000;
    public static final long MAX_MONEY = 21000000 * COIN;

    public static boolean isValidMoneyRange(long value) {
        return value >= 0 && value <= MAX_MONEY;
    }

    /**
     * Formats a satoshi amount the way MC `FormatMoney` does: whole coins, a dot and the fraction,
     * trailing zeros trimmed but never below two decimal digits. For example 100000000 -> "1.00",
     * 150000 -> "0.0015".
     */
    public static String formatMoney(long amount) {
        long abs = Math.abs(amount);
        StringBuilder str = new StringBuilder(String.format("%d.%08d", abs / COIN, abs % COIN));

        int trim = 0;
        for (int i = str.length() - 1; str.charAt(i) == '0' && Character.isDigit(str.charAt(i - 2)); --i)
            ++trim;
        str.setLength(str.length() - trim);

        if (amount < 0)
            str.insert(0, '-');
        return str.toString();
    }
}
