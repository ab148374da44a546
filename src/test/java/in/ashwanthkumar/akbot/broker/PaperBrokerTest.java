package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.TradingException;
import in.ashwanthkumar.akbot.model.OrderOp;
import in.ashwanthkumar.akbot.model.PriceSample;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class PaperBrokerTest {
    private static final Contract MES = Contract.of("MES", "CME", "USD", "202512");
    private static final Instant T0 = Instant.parse("2025-03-10T10:00:00Z");

    private PaperBroker broker;
    private List<Fill> fills;

    @Before
    public void setUp() {
        broker = new PaperBroker(20);
        fills = new ArrayList<>();
        broker.addFillListener(fills::add);
    }

    @Test
    public void testLongEntryAndTakeProfit() {
        publish(0, 11.0);
        BracketHandles handles = broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
        assertThat(broker.hasOpenPosition(MES), is(true));
        assertThat(broker.workingOrders(MES), is(2));

        publish(1, 14.0);
        assertThat(fills.size(), is(1));
        publish(2, 15.5);

        assertThat(fills.get(1).getOrderId(), is(handles.getTakeProfitId()));
        assertThat(fills.get(1).getPrice(), is(15.0));
        assertThat(broker.getPnl(), is(4.0));
        assertThat(broker.getCharges(), is(40.0));
        assertThat(broker.hasOpenPosition(MES), is(false));
        assertThat(broker.workingOrders(MES), is(0));
        assertThat(broker.getOrderBook().size(), is(2));
    }

    @Test
    public void testShortEntryAndStopLoss() {
        publish(0, 11.0);
        BracketHandles handles = broker.submitBracket(new BracketOrder(MES, OrderOp.SELL, 1, 11.0, 9.0, 15.0));
        publish(1, 15.25);

        assertThat(fills.get(1).getOrderId(), is(handles.getStopLossId()));
        // stops fill at the market
        assertThat(broker.getPnl(), is(-4.25));
        assertThat(broker.hasOpenPosition(MES), is(false));
    }

    @Test
    public void testOnlyEntry() {
        publish(0, 11.0);
        broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 2, 11.0, 15.0, 9.0));
        assertThat(broker.getPnl(), is(0.0));
        assertThat(broker.getCharges(), is(20.0));
        assertThat(broker.position(MES).get().getQuantity(), is(2));
        assertThat(broker.getOrderBook().size(), is(1));
    }

    @Test
    public void testFlattenClosesAtTheLastPrice() {
        publish(0, 11.0);
        broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
        publish(1, 12.5);
        broker.cancelAll(MES);

        String id = broker.flatten(MES).get();
        assertThat(fills.get(1).getOrderId(), is(id));
        assertThat(fills.get(1).getOp(), is(OrderOp.SELL));
        assertThat(broker.getPnl(), closeTo(1.5, 1e-9));
        assertThat(broker.flatten(MES).isPresent(), is(false));
    }

    @Test
    public void testFillsAreReportedInOrder() {
        publish(0, 11.0);
        BracketHandles handles = broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
        publish(1, 8.0);
        List<String> ids = new ArrayList<>();
        fills.forEach(f -> ids.add(f.getOrderId()));
        assertThat(ids, contains(handles.getEntryId(), handles.getStopLossId()));
    }

    @Test(expected = OrderSubmissionException.class)
    public void testBracketWithoutAPriceIsRejected() {
        broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
    }

    @Test(expected = OrderSubmissionException.class)
    public void testSecondBracketWhileOpenIsRejected() {
        publish(0, 11.0);
        broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
        broker.submitBracket(new BracketOrder(MES, OrderOp.BUY, 1, 11.0, 15.0, 9.0));
    }

    @Test(expected = TradingException.class)
    public void testFetchBeforeAnyPriceFails() {
        broker.fetchPrice(MES);
    }

    private void publish(int second, double price) {
        broker.publish(MES, PriceSample.of(T0.plusSeconds(second), price));
    }
}
