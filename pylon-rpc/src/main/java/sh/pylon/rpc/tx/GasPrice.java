// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Price of one unit of gas in a denomination.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * GasPrice price = GasPrice.parse("0.001upokt");
 * Coin fee = price.feeFor(120_000); // 120upokt
 * }</pre>
 *
 * @param amount price per gas unit (must be &gt;= 0)
 * @param denom  fee denomination
 */
public record GasPrice(BigDecimal amount, String denom) {

    private static final Pattern GAS_PRICE = Pattern.compile("^(\\d+(?:\\.\\d+)?)([a-zA-Z][a-zA-Z0-9/:._-]{2,127})$");

    public GasPrice {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(denom, "denom");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("gas price must be >= 0, got: " + amount);
        }
        if (denom.isEmpty()) {
            throw new IllegalArgumentException("denom cannot be empty");
        }
    }

    /**
     * Parses a decimal coin string such as {@code 0.001upokt}.
     *
     * @throws IllegalArgumentException if the string is not a decimal amount followed by a denom
     */
    public static GasPrice parse(final String value) {
        Objects.requireNonNull(value, "value");
        Matcher m = GAS_PRICE.matcher(value.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid gas price: " + value);
        }
        return new GasPrice(new BigDecimal(m.group(1)), m.group(2));
    }

    /**
     * Computes the fee for {@code gasLimit} gas.
     *
     * <p>
     * The product is truncated to an integer, plus one if anything was
     * truncated, so the fee is never below the exact price.
     */
    public Coin feeFor(final long gasLimit) {
        if (gasLimit < 0) {
            throw new IllegalArgumentException("gasLimit must be >= 0, got: " + gasLimit);
        }
        BigDecimal exact = amount.multiply(BigDecimal.valueOf(gasLimit));
        BigDecimal truncated = exact.setScale(0, RoundingMode.DOWN);
        if (exact.compareTo(truncated) > 0) {
            truncated = truncated.add(BigDecimal.ONE);
        }
        return new Coin(denom, truncated.toBigIntegerExact());
    }

    @Override
    public String toString() {
        return amount.toPlainString() + denom;
    }
}
