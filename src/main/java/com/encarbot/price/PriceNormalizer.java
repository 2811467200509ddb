package com.encarbot.price;

import com.encarbot.model.LeaseTerms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Price and lease normalization. The canonical unit is 만원 (10,000 won); every amount
 * returned here is expressed in it.
 *
 * <p>Lease extraction runs an ordered list of label-anchored patterns per field. Exact
 * "label: amount" matches are tried first; a proximity match (first number within a short
 * window after the label) is used only when no exact match exists. Each candidate is
 * checked against the field's plausible range, retrying once at x100 only for values that the
 * page printed in 백만원-style decimals (1.65 for 165만원).
 */
public final class PriceNormalizer {
    private static final Logger LOG = LogManager.getLogger(PriceNormalizer.class);

    public static final String MAJOR_UNIT = "만원";
    public static final String MINOR_UNIT = "원";
    private static final double MINOR_PER_MAJOR = 10_000.0;
    private static final int PROXIMITY_WINDOW = 48;

    private static final Pattern CANONICAL_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final String AMOUNT = "([0-9][0-9,]*(?:\\.[0-9]+)?)";

    static final List<String> LEASE_VOCABULARY = List.of(
            "리스", "렌트", "월세", "월납입금", "월 납입금", "보증금", "계약금", "리스료",
            "월리스", "리스기간", "월 렌트비", "렌트료", "인수금"
    );
    private static final List<String> TITLE_LEASE_KEYWORDS = List.of("리스", "렌트", "월세");

    private static final List<AmountRule> DEPOSIT_RULES = amountRules(
            "인수금", "보증금", "계약금", "선수금", "초기금"
    );
    private static final List<AmountRule> MONTHLY_RULES = amountRules(
            "월\\s*납입금", "월\\s*리스료", "월\\s*렌트비", "월\\s*렌트료", "월세", "월납"
    );
    private static final List<AmountRule> VEHICLE_PRICE_RULES = amountRules(
            "차량\\s*가격", "차량가"
    );
    private static final List<AmountRule> FINAL_PAYMENT_RULES = amountRules(
            "리스\\s*만기\\s*후\\s*비용", "만기\\s*인수\\s*비용", "잔존\\s*가치", "잔가"
    );
    private static final List<Pattern> TERM_LABELED = List.of(
            Pattern.compile("(?:리스|렌트|계약)\\s*기간\\s*[:：]?\\s*(\\d{1,3})\\s*개월")
    );
    private static final Pattern TERM_FALLBACK = Pattern.compile(
            "(?:리스|렌트|계약|기간|잔여)[^0-9]{0," + PROXIMITY_WINDOW + "}?(\\d{1,3})\\s*개월");

    private PriceNormalizer() {
    }

    /**
     * Parses a marketplace price into 만원. Numbers are taken as already canonical; strings
     * ending in 원 (but not 만원) are won and divided by 10,000; strings with 만원 or no
     * suffix are canonical, commas allowed.
     */
    public static double parsePrice(Object value) throws PriceParseException {
        if (value == null) {
            throw new PriceParseException(null, "empty");
        }
        if (value instanceof Number number) {
            double amount = number.doubleValue();
            if (!Double.isFinite(amount) || amount < 0) {
                throw new PriceParseException(value, "not a finite non-negative number");
            }
            return amount;
        }
        String text = PageText.normalize(String.valueOf(value));
        if (text.isEmpty()) {
            throw new PriceParseException(value, "empty");
        }
        if (text.contains(MINOR_UNIT) && !text.contains(MAJOR_UNIT)) {
            String digits = text.replace(MINOR_UNIT, "").replace(",", "").replace(" ", "");
            if (!digits.matches("\\d+")) {
                throw new PriceParseException(value, "won amount without digits");
            }
            return Double.parseDouble(digits) / MINOR_PER_MAJOR;
        }
        String numeric = text.replace(MAJOR_UNIT, "").replace(",", "").replace(" ", "");
        if (!CANONICAL_NUMBER.matcher(numeric).matches()) {
            throw new PriceParseException(value, "no numeric amount");
        }
        return Double.parseDouble(numeric);
    }

    /**
     * Lenient variant for call sites that degrade instead of failing.
     */
    public static double parsePriceOr(Object value, double fallback) {
        try {
            return parsePrice(value);
        } catch (PriceParseException e) {
            LOG.warn("price parse failed, using fallback={} cause={}", fallback, e.getMessage());
            return fallback;
        }
    }

    public static double computeLeaseTrueCost(double deposit, double monthly, int termMonths) {
        return computeLeaseTrueCost(deposit, monthly, termMonths, 0.0);
    }

    public static double computeLeaseTrueCost(double deposit, double monthly, int termMonths, double finalPayment) {
        return deposit + monthly * termMonths + finalPayment;
    }

    public static boolean hasLeaseVocabulary(String pageText) {
        if (pageText == null || pageText.isEmpty()) {
            return false;
        }
        for (String keyword : LEASE_VOCABULARY) {
            if (pageText.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Conservative lease guess for items seen only through the list endpoint.
     */
    public static boolean looksLikeLeaseTitle(String title) {
        if (title == null || title.isEmpty()) {
            return false;
        }
        for (String keyword : TITLE_LEASE_KEYWORDS) {
            if (title.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scans rendered page text (not markup; see {@link PageText#fromHtml}) for lease
     * components. Empty when the text has no lease vocabulary at all; otherwise a possibly
     * partial {@link LeaseTerms}.
     */
    public static Optional<LeaseTerms> extractLeaseTerms(String pageText) {
        String text = PageText.normalize(pageText);
        if (!hasLeaseVocabulary(text)) {
            return Optional.empty();
        }
        Double deposit = firstPlausible(text, DEPOSIT_RULES, AmountField.DEPOSIT);
        Double monthly = firstPlausible(text, MONTHLY_RULES, AmountField.MONTHLY);
        Integer term = extractTerm(text);
        Double finalPayment = firstPlausible(text, FINAL_PAYMENT_RULES, AmountField.FINAL_PAYMENT);
        Double vehiclePrice = firstPlausible(text, VEHICLE_PRICE_RULES, AmountField.VEHICLE_PRICE);

        LeaseTerms terms = new LeaseTerms(deposit, monthly, term, finalPayment, vehiclePrice);
        if (!terms.isComplete()) {
            LOG.debug("partial lease terms: deposit={} monthly={} term={}", deposit, monthly, term);
        }
        return Optional.of(terms);
    }

    public static String formatManwon(double amount) {
        if (Math.rint(amount) == amount) {
            return String.format(Locale.US, "%,.0f%s", amount, MAJOR_UNIT);
        }
        return String.format(Locale.US, "%,.1f%s", amount, MAJOR_UNIT);
    }

    static Integer extractTerm(String text) {
        for (Pattern pattern : TERM_LABELED) {
            Integer term = firstTerm(pattern.matcher(text));
            if (term != null) {
                return term;
            }
        }
        return firstTerm(TERM_FALLBACK.matcher(text));
    }

    private static Integer firstTerm(Matcher matcher) {
        while (matcher.find()) {
            int months = Integer.parseInt(matcher.group(1));
            if (months >= 12 && months <= 60) {
                return months;
            }
        }
        return null;
    }

    private static Double firstPlausible(String text, List<AmountRule> rules, AmountField field) {
        for (AmountRule rule : rules) {
            Double value = scan(rule.exact.matcher(text), field);
            if (value != null) {
                return value;
            }
        }
        for (AmountRule rule : rules) {
            Double value = scan(rule.proximity.matcher(text), field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double scan(Matcher matcher, AmountField field) {
        while (matcher.find()) {
            String printed = matcher.group(1).replace(",", "");
            double raw;
            try {
                raw = Double.parseDouble(printed);
            } catch (NumberFormatException e) {
                continue;
            }
            Double accepted = field.accept(raw, printed.contains("."));
            if (accepted != null) {
                return accepted;
            }
            LOG.debug("rejected implausible {}={}", field, raw);
        }
        return null;
    }

    private static List<AmountRule> amountRules(String... labels) {
        AmountRule[] rules = new AmountRule[labels.length];
        for (int i = 0; i < labels.length; i++) {
            rules[i] = new AmountRule(
                    Pattern.compile(labels[i] + "\\s*[:：]?\\s*" + AMOUNT + "\\s*" + MAJOR_UNIT),
                    Pattern.compile(labels[i] + "[^0-9]{0," + PROXIMITY_WINDOW + "}?" + AMOUNT + "\\s*" + MAJOR_UNIT)
            );
        }
        return List.of(rules);
    }

    private record AmountRule(Pattern exact, Pattern proximity) {
    }

    private enum AmountField {
        DEPOSIT(100.0, 30_000.0),
        MONTHLY(10.0, 1_000.0),
        FINAL_PAYMENT(0.0, 30_000.0),
        VEHICLE_PRICE(500.0, 50_000.0);

        private final double min;
        private final double max;

        AmountField(double min, double max) {
            this.min = min;
            this.max = max;
        }

        Double accept(double raw, boolean fractional) {
            if (raw >= min && raw <= max) {
                return raw;
            }
            // only decimal prints like 1.65 are 백만원-style; a whole 50 is just too small
            if (!fractional) {
                return null;
            }
            double rescaled = Math.round(raw * 10_000.0) / 100.0;
            if (raw < min && rescaled >= min && rescaled <= max) {
                return rescaled;
            }
            return null;
        }
    }
}
