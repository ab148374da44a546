package in.ashwanthkumar.akbot.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Top level of the config file: every strategy instance plus the settings shared by all of them.
 */
@Getter
@Setter
@ToString
@NoArgsConstructor
public class BotConfig {
    public static final String DEFAULT_TRADE_END = "23:00";

    private List<StrategySettings> strategies = new ArrayList<>();
    // instances whose events are mirrored to the console
    private List<String> consoleAllowList = new ArrayList<>();
    // force-close time for instances that don't set their own
    private String defaultForceClose;
    // new-order cutoff for instances that don't set their own
    private String tradeEnd = DEFAULT_TRADE_END;
    // charged by the paper broker for every executed order
    private double perOrderCharge;
}
