package in.ashwanthkumar.akbot.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
public class ContractSettings {
    private String symbol;
    private String exchange;
    private String currency;
    private String expiry;
}
