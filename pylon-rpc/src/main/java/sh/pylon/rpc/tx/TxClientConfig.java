// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.util.Objects;

/**
 * Configuration for {@link DefaultTxClient}.
 *
 * <ul>
 *   <li>{@code signingKeyName} - keyring entry that signs every transaction (required)</li>
 *   <li>{@code commitTimeoutHeightOffset} - blocks after the latest height at which a transaction times out (default: 5)</li>
 *   <li>{@code gasAdjustment} - multiplier applied to simulated gas (default: 1.5)</li>
 *   <li>{@code gasPrice} - price used to compute the fee (default: 0.001upokt)</li>
 *   <li>{@code connRetryLimit} - reconnect limit of the own-transaction subscription; negative retries forever (default: -1)</li>
 * </ul>
 *
 * @param signingKeyName            keyring entry name
 * @param commitTimeoutHeightOffset timeout offset in blocks; zero or less falls back to the default
 * @param gasAdjustment             simulated gas multiplier (must be &gt;= 1)
 * @param gasPrice                  fee price per gas unit
 * @param connRetryLimit            subscription reconnect limit
 */
public record TxClientConfig(
        String signingKeyName,
        long commitTimeoutHeightOffset,
        double gasAdjustment,
        GasPrice gasPrice,
        int connRetryLimit) {

    /** Default timeout offset: 5 blocks. */
    public static final long DEFAULT_COMMIT_TIMEOUT_HEIGHT_OFFSET = 5;

    /** Default gas adjustment: 1.5. */
    public static final double DEFAULT_GAS_ADJUSTMENT = 1.5;

    /** Default gas price: 0.001upokt. */
    public static final GasPrice DEFAULT_GAS_PRICE = GasPrice.parse("0.001upokt");

    public TxClientConfig {
        Objects.requireNonNull(signingKeyName, "signingKeyName");
        Objects.requireNonNull(gasPrice, "gasPrice");
        if (signingKeyName.isBlank()) {
            throw new IllegalArgumentException("signingKeyName cannot be blank");
        }
        if (commitTimeoutHeightOffset <= 0) {
            commitTimeoutHeightOffset = DEFAULT_COMMIT_TIMEOUT_HEIGHT_OFFSET;
        }
        if (!(gasAdjustment >= 1.0) || Double.isInfinite(gasAdjustment)) {
            throw new IllegalArgumentException("gasAdjustment must be a finite value >= 1, got: " + gasAdjustment);
        }
    }

    /**
     * @return the defaults for everything but the signing key
     */
    public static TxClientConfig defaults(final String signingKeyName) {
        return builder().signingKeyName(signingKeyName).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link TxClientConfig}. Only the signing key name has no default.
     */
    public static final class Builder {
        private String signingKeyName;
        private long commitTimeoutHeightOffset = DEFAULT_COMMIT_TIMEOUT_HEIGHT_OFFSET;
        private double gasAdjustment = DEFAULT_GAS_ADJUSTMENT;
        private GasPrice gasPrice = DEFAULT_GAS_PRICE;
        private int connRetryLimit = -1;

        private Builder() {}

        public Builder signingKeyName(String signingKeyName) {
            this.signingKeyName = signingKeyName;
            return this;
        }

        public Builder commitTimeoutHeightOffset(long commitTimeoutHeightOffset) {
            this.commitTimeoutHeightOffset = commitTimeoutHeightOffset;
            return this;
        }

        public Builder gasAdjustment(double gasAdjustment) {
            this.gasAdjustment = gasAdjustment;
            return this;
        }

        public Builder gasPrice(GasPrice gasPrice) {
            this.gasPrice = gasPrice;
            return this;
        }

        public Builder connRetryLimit(int connRetryLimit) {
            this.connRetryLimit = connRetryLimit;
            return this;
        }

        public TxClientConfig build() {
            return new TxClientConfig(
                    signingKeyName, commitTimeoutHeightOffset, gasAdjustment, gasPrice, connRetryLimit);
        }
    }
}
