package in.ashwanthkumar.akbot.broker;

import in.ashwanthkumar.akbot.TradingException;
import in.ashwanthkumar.akbot.model.OrderOp;
import in.ashwanthkumar.akbot.model.OrderType;
import in.ashwanthkumar.akbot.model.Position;
import in.ashwanthkumar.akbot.model.PositionExecutionResult;
import in.ashwanthkumar.akbot.model.PriceSample;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process broker used for replays and tests. Prices are published into it, market
 * orders fill at the last published price, the exit legs of a bracket trigger against
 * later prices and cancel each other when one fills.
 */
@Slf4j
@RequiredArgsConstructor
public class PaperBroker implements BrokerGateway {
    // fixed charge added for each executed order
    private final double perOrderCharge;

    private final Map<Contract, PriceSample> lastPrices = new HashMap<>();
    private final Map<Contract, Position> positions = new HashMap<>();
    private final List<WorkingOrder> workingOrders = new LinkedList<>();
    @Getter
    private final List<Fill> orderBook = new LinkedList<>();
    private final List<Consumer<Fill>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();
    @Getter
    private double pnl = 0.0;
    @Getter
    private double charges = 0.0;

    /**
     * Make {@code sample} the current price of the contract and trigger any working exit leg it crosses.
     */
    public void publish(Contract contract, PriceSample sample) {
        List<Fill> fills = new ArrayList<>();
        synchronized (this) {
            lastPrices.put(contract, sample);
            Iterator<WorkingOrder> it = workingOrders.iterator();
            WorkingOrder triggered = null;
            while (it.hasNext() && triggered == null) {
                WorkingOrder order = it.next();
                if (order.contract.equals(contract) && order.isTriggeredBy(sample.getPrice())) {
                    triggered = order;
                }
            }
            if (triggered != null) {
                double fillPrice = triggered.type == OrderType.LIMIT ? triggered.price : sample.getPrice();
                fills.add(execute(triggered.id, contract, triggered.op, triggered.quantity, fillPrice, sample));
                String group = triggered.group;
                workingOrders.removeIf(o -> o.group.equals(group));
            }
        }
        fills.forEach(this::notifyListeners);
    }

    @Override
    public synchronized PriceSample fetchPrice(Contract contract) {
        PriceSample sample = lastPrices.get(contract);
        if (sample == null) {
            throw new TradingException("No price published yet for " + contract);
        }
        return sample;
    }

    @Override
    public BracketHandles submitBracket(BracketOrder order) {
        Fill entryFill;
        BracketHandles handles;
        synchronized (this) {
            Contract contract = order.getContract();
            PriceSample last = lastPrices.get(contract);
            if (last == null) {
                throw new OrderSubmissionException("No market price for " + contract + ", bracket rejected");
            }
            if (positions.containsKey(contract)) {
                throw new OrderSubmissionException("Position already open on " + contract + ", bracket rejected");
            }
            String entryId = nextId();
            handles = BracketHandles.of(entryId, nextId(), nextId());
            workingOrders.add(new WorkingOrder(handles.getTakeProfitId(), entryId, contract, order.exitOp(), OrderType.LIMIT, order.getQuantity(), order.getTakeProfit()));
            workingOrders.add(new WorkingOrder(handles.getStopLossId(), entryId, contract, order.exitOp(), OrderType.STOP, order.getQuantity(), order.getStopLoss()));
            entryFill = execute(entryId, contract, order.getOp(), order.getQuantity(), last.getPrice(), last);
            log.debug("Bracket {} accepted: {}", handles, order);
        }
        notifyListeners(entryFill);
        return handles;
    }

    @Override
    public synchronized void cancelAll(Contract contract) {
        workingOrders.removeIf(o -> o.contract.equals(contract));
    }

    @Override
    public Optional<String> flatten(Contract contract) {
        Fill fill;
        synchronized (this) {
            Position position = positions.get(contract);
            if (position == null) {
                return Optional.empty();
            }
            PriceSample last = lastPrices.get(contract);
            if (last == null) {
                throw new OrderSubmissionException("No market price for " + contract + ", can't flatten");
            }
            fill = execute(nextId(), contract, position.getOp().opposite(), position.getQuantity(), last.getPrice(), last);
        }
        notifyListeners(fill);
        return Optional.of(fill.getOrderId());
    }

    @Override
    public synchronized boolean hasOpenPosition(Contract contract) {
        return positions.containsKey(contract);
    }

    @Override
    public void addFillListener(Consumer<Fill> listener) {
        listeners.add(listener);
    }

    public synchronized Optional<Position> position(Contract contract) {
        return Optional.ofNullable(positions.get(contract));
    }

    public synchronized int workingOrders(Contract contract) {
        return (int) workingOrders.stream().filter(o -> o.contract.equals(contract)).count();
    }

    private Fill execute(String orderId, Contract contract, OrderOp op, int quantity, double price, PriceSample at) {
        charges += perOrderCharge;
        Position current = positions.get(contract);
        if (current == null) {
            positions.put(contract, Position.of(contract.getSymbol(), op, quantity, price));
        } else if (current.getOp() == op) {
            int total = current.getQuantity() + quantity;
            double average = (current.getPrice() * current.getQuantity() + price * quantity) / total;
            positions.put(contract, Position.of(contract.getSymbol(), op, total, average));
        } else {
            PositionExecutionResult result = current.exitWith(op, quantity, price);
            pnl += result.getPnl();
            if (result.isFlat()) {
                positions.remove(contract);
            } else {
                positions.put(contract, result.getPosition());
            }
        }
        Fill fill = new Fill(orderId, contract, op, quantity, price, at.getTime());
        orderBook.add(fill);
        return fill;
    }

    private void notifyListeners(Fill fill) {
        for (Consumer<Fill> listener : listeners) {
            listener.accept(fill);
        }
    }

    private String nextId() {
        return "paper-" + ids.incrementAndGet();
    }

    @RequiredArgsConstructor
    private static class WorkingOrder {
        private final String id;
        // legs of the same bracket cancel each other
        private final String group;
        private final Contract contract;
        private final OrderOp op;
        private final OrderType type;
        private final int quantity;
        private final double price;

        boolean isTriggeredBy(double market) {
            if (type == OrderType.LIMIT) {
                return op == OrderOp.SELL ? market >= price : market <= price;
            }
            return op == OrderOp.SELL ? market <= price : market >= price;
        }
    }
}
