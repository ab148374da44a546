package in.ashwanthkumar.akbot.model;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
@Getter
public class PositionExecutionResult {
    // position left after the fill, quantity 0 when flat
    @NonNull
    private final Position position;
    // realised pnl of the matched quantity
    private final double pnl;

    public boolean isFlat() {
        return position.getQuantity() == 0;
    }
}
