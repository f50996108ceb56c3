// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An amount of a single denomination.
 *
 * @param denom  the denomination, e.g. {@code upokt}
 * @param amount the non-negative amount
 */
public record Coin(String denom, BigInteger amount) {

    public Coin {
        Objects.requireNonNull(denom, "denom");
        Objects.requireNonNull(amount, "amount");
        if (denom.isEmpty()) {
            throw new IllegalArgumentException("denom cannot be empty");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got: " + amount);
        }
    }

    public static Coin of(final long amount, final String denom) {
        return new Coin(denom, BigInteger.valueOf(amount));
    }

    /**
     * @return the amount followed by the denom, e.g. {@code 120upokt}
     */
    @Override
    public String toString() {
        return amount + denom;
    }
}
