package in.ashwanthkumar.akbot.lifecycle;

import in.ashwanthkumar.akbot.broker.BracketOrder;
import in.ashwanthkumar.akbot.broker.Contract;
import in.ashwanthkumar.akbot.model.OrderOp;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class BracketSpecTest {
    private static final Contract MES = Contract.of("MES", "CME", "USD", "202512");

    @Test
    public void testLongBracket() {
        BracketSpec spec = BracketSpec.builder().tickSize(0.25).slTicks(20).tpTicksLong(60).quantity(2).build();
        BracketOrder order = spec.bracket(MES, OrderOp.BUY, 5000.0);
        assertThat(order.getTakeProfit(), is(5015.0));
        assertThat(order.getStopLoss(), is(4995.0));
        assertThat(order.getQuantity(), is(2));
        assertThat(order.exitOp(), is(OrderOp.SELL));
    }

    @Test
    public void testShortBracket() {
        BracketSpec spec = BracketSpec.builder().tickSize(0.01).slTicks(20).tpTicksShort(45).build();
        BracketOrder order = spec.bracket(MES, OrderOp.SELL, 100.0);
        assertThat(order.getTakeProfit(), is(99.55));
        assertThat(order.getStopLoss(), is(100.2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveQuantityIsRejected() {
        BracketSpec.builder().quantity(0).build();
    }
}
