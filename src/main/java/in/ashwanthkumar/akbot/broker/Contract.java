package in.ashwanthkumar.akbot.broker;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Futures contract a strategy instance trades.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(staticName = "of")
public class Contract {
    private final String symbol;
    private final String exchange;
    private final String currency;
    // contract month, e.g. 202512, optional for continuous feeds
    private final String expiry;

    public static Contract validated(String symbol, String exchange, String currency, String expiry) {
        Preconditions.checkArgument(StringUtils.isNotBlank(symbol), "Missing or empty contract symbol");
        Preconditions.checkArgument(StringUtils.isNotBlank(exchange), "Missing or empty contract exchange");
        Preconditions.checkArgument(StringUtils.isNotBlank(currency), "Missing or empty contract currency");
        return Contract.of(symbol, exchange, currency, StringUtils.trimToNull(expiry));
    }

    @Override
    public String toString() {
        return expiry == null ? symbol + "@" + exchange : symbol + " " + expiry + "@" + exchange;
    }
}
