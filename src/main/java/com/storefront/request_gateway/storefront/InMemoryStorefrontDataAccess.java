package com.storefront.request_gateway.storefront;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Storefront data held in memory and seeded with a small catalogue, two warehouses
 * and one demo customer.
 *
 * Placing an order reserves its quantities in the first warehouse that has enough
 * stock for each line.
 */
@Component
public class InMemoryStorefrontDataAccess implements StorefrontDataAccess {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorefrontDataAccess.class);

    public static final String DEMO_CUSTOMER_ID = "6f1c2a9e-3b7d-4c5e-8a1f-2d9b0e4c7a13";
    public static final String MAIN_WAREHOUSE = "WH001";
    public static final String SECONDARY_WAREHOUSE = "WH002";

    private static final int RECENT_ORDER_COUNT = 10;
    private static final Duration DELIVERY_LEAD_TIME = Duration.ofDays(1);

    private final Clock clock;
    private final Map<String, Product> products = new LinkedHashMap<>();
    private final Map<String, Customer> customers = new ConcurrentHashMap<>();
    private final Map<String, Order> orders = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> stock = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> reserved = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> shippingCosts = Map.of(
            MAIN_WAREHOUSE, new BigDecimal("10.00"),
            SECONDARY_WAREHOUSE, new BigDecimal("14.50"));
    private final AtomicLong orderSequence = new AtomicLong();

    public InMemoryStorefrontDataAccess(Clock clock) {
        this.clock = clock;
        seed();
    }

    private void seed() {
        Instant now = clock.instant();
        addProduct("0b6f1f3e-5d1a-4a3c-9e47-1c2d3e4f5a61", "Linen Throw Pillow", "home", "24.99", 40, 15, now);
        addProduct("1c7a2b4f-6e2b-4b4d-8f58-2d3e4f5a6b72", "Stoneware Mug Set", "kitchen", "32.00", 25, 10, now);
        addProduct("2d8b3c5a-7f3c-4c5e-9a69-3e4f5a6b7c83", "Cast Iron Skillet", "kitchen", "45.50", 12, 0, now);
        addProduct("3e9c4d6b-8a4d-4d6f-8b7a-4f5a6b7c8d94", "Wool Blanket", "home", "89.00", 8, 4, now);
        addProduct("4fad5e7c-9b5e-4e7a-9c8b-5a6b7c8d9ea5", "Desk Lamp", "office", "58.75", 30, 20, now);
        addProduct("5abe6f8d-ac6f-4f8b-8d9c-6b7c8d9e0fb6", "Notebook Bundle", "office", "12.40", 100, 60, now);

        customers.put(DEMO_CUSTOMER_ID,
                new Customer(DEMO_CUSTOMER_ID, "demo@storefront.example", "Dana", "Moreau", now, List.of()));
    }

    private void addProduct(String id, String name, String category, String price,
                            int mainStock, int secondaryStock, Instant createdAt) {
        int total = mainStock + secondaryStock;
        products.put(id, new Product(id, name, category, new BigDecimal(price), total, createdAt));
        Map<String, Integer> byWarehouse = new ConcurrentHashMap<>();
        byWarehouse.put(MAIN_WAREHOUSE, mainStock);
        byWarehouse.put(SECONDARY_WAREHOUSE, secondaryStock);
        stock.put(id, byWarehouse);
        reserved.put(id, new ConcurrentHashMap<>());
    }

    @Override
    public ProductPage findProducts(ProductQuery query) {
        List<Product> matching = products.values().stream()
                .filter(p -> query.category() == null || p.category().equalsIgnoreCase(query.category()))
                .filter(p -> query.search() == null
                        || p.name().toLowerCase(Locale.ROOT).contains(query.search().toLowerCase(Locale.ROOT)))
                .sorted(comparator(query.sortBy(), query.sortOrder()))
                .toList();

        int from = Math.min((query.page() - 1) * query.limit(), matching.size());
        int to = Math.min(from + query.limit(), matching.size());
        long total = matching.size();
        long pages = (total + query.limit() - 1) / query.limit();

        return new ProductPage(matching.subList(from, to),
                new ProductPage.Pagination(query.page(), query.limit(), total, pages));
    }

    private static Comparator<Product> comparator(String sortBy, String sortOrder) {
        Comparator<Product> comparator = switch (sortBy == null ? "" : sortBy) {
            case "name" -> Comparator.comparing(Product::name);
            case "price" -> Comparator.comparing(Product::price);
            case "created" -> Comparator.comparing(Product::createdAt);
            default -> (a, b) -> 0;
        };
        return "desc".equals(sortOrder) ? comparator.reversed() : comparator;
    }

    @Override
    public Optional<Customer> findCustomer(String customerId) {
        Customer customer = customers.get(customerId);
        if (customer == null) {
            return Optional.empty();
        }
        List<Order> recent = orders.values().stream()
                .filter(order -> order.customerId().equals(customerId))
                .sorted(Comparator.comparing(Order::createdAt).reversed())
                .limit(RECENT_ORDER_COUNT)
                .toList();
        return Optional.of(new Customer(customer.id(), customer.email(), customer.firstName(),
                customer.lastName(), customer.createdAt(), recent));
    }

    @Override
    public synchronized Order createOrder(NewOrder request) {
        List<Order.Line> lines = new ArrayList<>();
        BigDecimal subtotal = BigDecimal.ZERO;
        for (NewOrder.Item item : request.items()) {
            BigDecimal lineTotal = item.price().multiply(BigDecimal.valueOf(item.quantity()));
            lines.add(new Order.Line(item.productId(), item.quantity(), item.price(), lineTotal));
            subtotal = subtotal.add(lineTotal);
            reserve(item.productId(), item.quantity());
        }

        Instant now = clock.instant();
        Order order = new Order(
                UUID.randomUUID().toString(),
                "ORD-" + now.toEpochMilli() + "-" + orderSequence.incrementAndGet(),
                request.customerId(),
                "pending",
                lines,
                subtotal,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                subtotal,
                request.shippingAddress(),
                now);
        orders.put(order.id(), order);
        log.info("Created order {} for customer={} total={}", order.orderNumber(), order.customerId(), order.total());
        return order;
    }

    private void reserve(String productId, int quantity) {
        Map<String, Integer> byWarehouse = stock.get(productId);
        if (byWarehouse == null) {
            return;
        }
        Map<String, Integer> reservations = reserved.get(productId);
        for (String warehouse : List.of(MAIN_WAREHOUSE, SECONDARY_WAREHOUSE)) {
            int free = byWarehouse.getOrDefault(warehouse, 0) - reservations.getOrDefault(warehouse, 0);
            if (free >= quantity) {
                reservations.merge(warehouse, quantity, Integer::sum);
                return;
            }
        }
    }

    @Override
    public InventoryAvailability checkAvailability(String productId, int quantity, String warehouseId) {
        Map<String, Integer> byWarehouse = stock.getOrDefault(productId, Map.of());
        Map<String, Integer> reservations = reserved.getOrDefault(productId, Map.of());
        Instant estimatedDelivery = clock.instant().plus(DELIVERY_LEAD_TIME);

        List<InventoryAvailability.WarehouseStock> warehouses = new ArrayList<>();
        int totalAvailable = 0;
        for (Map.Entry<String, Integer> entry : byWarehouse.entrySet()) {
            String warehouse = entry.getKey();
            if (warehouseId != null && !warehouseId.equals(warehouse)) {
                continue;
            }
            int held = reservations.getOrDefault(warehouse, 0);
            int free = Math.max(0, entry.getValue() - held);
            totalAvailable += free;
            warehouses.add(new InventoryAvailability.WarehouseStock(
                    warehouse, free, held, estimatedDelivery, shippingCosts.get(warehouse)));
        }
        warehouses.sort(Comparator.comparing(InventoryAvailability.WarehouseStock::warehouseId));

        boolean available = totalAvailable >= quantity;
        List<String> alternatives = available ? List.of() : alternativesFor(productId, quantity);
        return new InventoryAvailability(productId, quantity, available, totalAvailable, warehouses, alternatives);
    }

    private List<String> alternativesFor(String productId, int quantity) {
        Product product = products.get(productId);
        if (product == null) {
            return List.of();
        }
        return products.values().stream()
                .filter(p -> !p.id().equals(productId))
                .filter(p -> p.category().equals(product.category()))
                .filter(p -> p.stock() >= quantity)
                .map(Product::id)
                .toList();
    }
}
