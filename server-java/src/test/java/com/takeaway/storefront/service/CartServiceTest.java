package com.takeaway.storefront.service;

import com.takeaway.storefront.dto.CartView;
import com.takeaway.storefront.model.MenuItem;
import com.takeaway.storefront.session.CheckoutSession;
import com.takeaway.storefront.session.CheckoutStep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CartServiceTest {

    @Mock
    private MenuService menuService;

    private CartService cartService;
    private CheckoutSession session;
    private final Map<Long, MenuItem> catalog = new HashMap<>();

    @BeforeEach
    void setUp() {
        cartService = new CartService(menuService);
        session = new CheckoutSession(1L, "jane@example.com");
        catalog.put(3L, item(3L, "Margherita", "9.50"));
        catalog.put(4L, item(4L, "Cola", "1.25"));
        when(menuService.findByIds(anyCollection())).thenAnswer(invocation -> {
            Collection<Long> ids = invocation.getArgument(0);
            Map<Long, MenuItem> found = new HashMap<>();
            for (Long id : ids) {
                if (catalog.containsKey(id)) {
                    found.put(id, catalog.get(id));
                }
            }
            return found;
        });
    }

    @Test
    void viewPricesEachLineAtCurrentPrice() {
        cartService.add(session, 3L);
        cartService.add(session, 3L);
        cartService.add(session, 4L);

        CartView view = cartService.view(session);

        assertThat(view.getLines()).hasSize(2);
        assertThat(view.getLines().get(0).getLineTotal()).isEqualByComparingTo("19.00");
        assertThat(view.getTotal()).isEqualByComparingTo("20.25");
        assertThat(view.getUnavailableItemIds()).isEmpty();
    }

    @Test
    void viewDropsItemsThatLeftTheMenu() {
        cartService.add(session, 3L);
        cartService.add(session, 99L);

        CartView view = cartService.view(session);

        assertThat(view.getLines()).extracting(line -> line.getItem().getId()).containsExactly(3L);
        assertThat(view.getTotal()).isEqualByComparingTo("9.50");
        assertThat(view.getUnavailableItemIds()).containsExactly(99L);
        assertThat(session.getCart().quantityOf(99L)).isEqualTo(1);
    }

    @Test
    void viewIsIdempotent() {
        cartService.add(session, 3L);
        cartService.add(session, 4L);

        CartView first = cartService.view(session);
        CartView second = cartService.view(session);

        assertThat(second).isEqualTo(first);
        assertThat(session.getCart().snapshot()).containsOnlyKeys(3L, 4L);
    }

    @Test
    void emptyingTheCartResetsTheCheckoutStep() {
        cartService.add(session, 3L);
        session.moveTo(CheckoutStep.DETAILS_PENDING);

        cartService.update(session, 3L, "dec");

        assertThat(session.getCart().isEmpty()).isTrue();
        assertThat(session.getStep()).isEqualTo(CheckoutStep.EMPTY_CART);
    }

    @Test
    void emptyCartViewHasZeroTotal() {
        CartView view = cartService.view(session);

        assertThat(view.isEmpty()).isTrue();
        assertThat(view.getTotal()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void cartChangesWaitWhileTheSessionIsLocked() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        Thread adder = new Thread(() -> {
            started.countDown();
            cartService.add(session, 3L);
        });

        synchronized (session) {
            adder.start();
            assertThat(started.await(1, TimeUnit.SECONDS)).isTrue();
            adder.join(200);

            assertThat(adder.isAlive()).isTrue();
            assertThat(session.getCart().isEmpty()).isTrue();
        }

        adder.join(1000);
        assertThat(session.getCart().quantityOf(3L)).isEqualTo(1);
    }

    private static MenuItem item(Long id, String name, String price) {
        MenuItem item = new MenuItem(name, "Main", "", new BigDecimal(price), null);
        item.setId(id);
        return item;
    }
}
