package com.gpuopt.application.payment;

import com.gpuopt.application.catalog.TierCatalog;
import com.gpuopt.application.identity.IdentityStore;
import com.gpuopt.application.notification.NotificationDispatcher;
import com.gpuopt.application.ports.PaymentTransactionRepository;
import com.gpuopt.domain.InvalidStateTransitionException;
import com.gpuopt.domain.NotFoundException;
import com.gpuopt.domain.ValidationException;
import com.gpuopt.domain.model.Customer;
import com.gpuopt.domain.model.PaymentStatus;
import com.gpuopt.domain.model.PaymentTransaction;
import com.gpuopt.domain.model.SubscriptionTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Payment creation, recording and confirmation across gateways.
 *
 * Rules:
 * - adapter failures become a failed {@link PaymentResult}, never an exception;
 * - a transaction leaves {@code pending} exactly once (compare-and-set in storage);
 * - completion and the tier upgrade commit together through {@link IdentityStore#applyPaymentCompletion}.
 */
public class PaymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PaymentOrchestrator.class);

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");
    static final int RECONCILE_BATCH = 100;

    private final IdentityStore identities;
    private final PaymentTransactionRepository transactions;
    private final GatewayRegistry registry;
    private final PaymentSettings settings;
    private final CurrencyConverter converter;
    private final NotificationDispatcher notifications;
    private final GatewaySelector selector;
    private final Clock clock;

    public PaymentOrchestrator(IdentityStore identities,
                               PaymentTransactionRepository transactions,
                               GatewayRegistry registry,
                               PaymentSettings settings,
                               CurrencyConverter converter,
                               NotificationDispatcher notifications,
                               Clock clock) {
        this.identities = Objects.requireNonNull(identities, "identities");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.notifications = Objects.requireNonNull(notifications, "notifications");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.selector = new GatewaySelector(this::isConfigured);
    }

    public GatewayId selectGateway(String countryCode) {
        return selector.select(countryCode);
    }

    public boolean isConfigured(GatewayId gateway) {
        if (gateway == GatewayId.DEMO) return true;
        return settings.credentials(gateway).covers(gateway.requiredCredentials())
                && registry.find(gateway).isPresent();
    }

    public List<GatewayOption> availableGateways(String countryCode) {
        List<GatewayOption> out = new ArrayList<>();
        for (GatewayId g : GatewayCatalog.DISPLAY_ORDER) {
            if (isConfigured(g) && GatewayCatalog.entry(g).serves(countryCode)) {
                out.add(GatewayCatalog.option(g));
            }
        }
        if (out.isEmpty()) {
            log.warn("No payment gateways configured for country={} - offering demo gateway", countryCode);
            out.add(GatewayCatalog.option(GatewayId.DEMO));
        }
        return out;
    }

    public PaymentResult createPayment(PaymentRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.customerEmail() == null || request.customerEmail().isBlank()) {
            throw new ValidationException("customer_email is required");
        }
        SubscriptionTier plan = requirePaidPlan(request.plan());
        String currency = normalizeCurrency(request.currency());
        BigDecimal amount = chargeAmount(plan, request.amount(), currency);

        Customer customer = identities.getByEmail(request.customerEmail())
                .orElseThrow(() -> new NotFoundException("Customer not found: " + request.customerEmail()));

        GatewayId gateway = request.gateway() != null ? request.gateway() : selectGateway(request.countryCode());

        if (gateway.usdOnly() && !CurrencyConverter.USD.equals(currency)) {
            amount = converter.toUsd(amount, currency);
            currency = CurrencyConverter.USD;
        }

        if (!isConfigured(gateway)) {
            log.warn("Payment requested on unconfigured gateway {}", gateway.code());
            return PaymentResult.failed(gateway, amount, currency, gateway.code() + " is not configured");
        }
        Optional<PaymentGatewayPort> adapter = registry.find(gateway);
        if (adapter.isEmpty()) {
            return PaymentResult.failed(gateway, amount, currency, gateway.code() + " is not available");
        }

        ChargeRequest charge = new ChargeRequest(customer.email(), plan, amount, currency, request.countryCode());
        GatewayCharge created;
        try {
            created = adapter.get().create(charge);
        } catch (GatewayException e) {
            log.warn("Gateway {} rejected payment for {}: {}", gateway.code(), customer.email(), e.getMessage());
            return PaymentResult.failed(gateway, amount, currency, "Payment creation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Gateway {} failed unexpectedly for {}", gateway.code(), customer.email(), e);
            return PaymentResult.failed(gateway, amount, currency, "Payment creation failed");
        }

        if (gateway != GatewayId.DEMO) {
            Instant now = clock.instant();
            recordTransaction(new PaymentTransaction(
                    created.paymentId(),
                    customer.email(),
                    gateway.code(),
                    plan,
                    amount,
                    currency,
                    PaymentStatus.PENDING,
                    created.metadataJson(),
                    now,
                    now
            ));
        }

        log.info("Payment created: gateway={} id={} email={} plan={} amount={} {}",
                gateway.code(), created.paymentId(), customer.email(), plan.code(), amount, currency);
        return PaymentResult.pending(gateway, created, amount, currency);
    }

    /**
     * Idempotent on {@code (gateway, paymentId)}; an existing row keeps its status.
     */
    public PaymentTransaction recordTransaction(PaymentTransaction tx) {
        Objects.requireNonNull(tx, "tx");
        if (tx.paymentId() == null || tx.paymentId().isBlank()) {
            throw new ValidationException("payment id is required");
        }
        return transactions.upsert(tx);
    }

    /**
     * Applies a provider-verified status.
     *
     * @throws NotFoundException                if the transaction is unknown
     * @throws InvalidStateTransitionException  if it already holds a different terminal status
     */
    public PaymentTransaction confirmTransaction(GatewayId gateway, String paymentId, PaymentStatus verified) {
        if (verified == null) {
            throw new ValidationException("status is required");
        }
        PaymentTransaction tx = transactions.find(gateway.code(), paymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + gateway.code() + "/" + paymentId));

        if (verified == PaymentStatus.PENDING || tx.status() == verified) {
            return tx;
        }
        if (!tx.status().canTransitionTo(verified)) {
            throw new InvalidStateTransitionException(
                    "Payment " + paymentId + " is " + tx.status().code() + ", cannot become " + verified.code());
        }

        if (verified == PaymentStatus.COMPLETED) {
            Optional<Customer> upgraded = identities.applyPaymentCompletion(tx);
            if (upgraded.isEmpty()) {
                return settledByOther(gateway, paymentId, tx, verified);
            }
            log.info("Payment {}/{} {} -> {}", gateway.code(), paymentId, tx.status().code(), verified.code());
            notifications.upgrade(tx.customerEmail(), tx.plan());
        } else {
            if (!transactions.compareAndSetStatus(gateway.code(), paymentId, PaymentStatus.PENDING, verified,
                    clock.instant())) {
                return settledByOther(gateway, paymentId, tx, verified);
            }
            log.info("Payment {}/{} {} -> {}", gateway.code(), paymentId, tx.status().code(), verified.code());
        }
        return transactions.find(gateway.code(), paymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + gateway.code() + "/" + paymentId));
    }

    /** A concurrent confirmation moved the row first; agreeing with it is a no-op. */
    private PaymentTransaction settledByOther(GatewayId gateway, String paymentId, PaymentTransaction seen,
                                              PaymentStatus verified) {
        PaymentTransaction current = transactions.find(gateway.code(), paymentId).orElse(seen);
        if (current.status() == verified) return current;
        throw new InvalidStateTransitionException(
                "Payment " + paymentId + " is " + current.status().code() + ", cannot become " + verified.code());
    }

    /**
     * Re-verifies a pending transaction with its provider. Provider errors leave it pending.
     */
    public PaymentTransaction checkStatus(GatewayId gateway, String paymentId) {
        PaymentTransaction tx = transactions.find(gateway.code(), paymentId)
                .orElseThrow(() -> new NotFoundException("Payment not found: " + gateway.code() + "/" + paymentId));
        if (tx.status().isTerminal()) return tx;

        Optional<PaymentGatewayPort> adapter = registry.find(gateway);
        if (adapter.isEmpty() || !isConfigured(gateway)) {
            log.warn("Cannot verify {}/{}: gateway not configured", gateway.code(), paymentId);
            return tx;
        }

        Optional<PaymentStatus> verified;
        try {
            verified = adapter.get().verify(paymentId);
        } catch (GatewayException e) {
            log.warn("Verification of {}/{} failed: {}", gateway.code(), paymentId, e.getMessage());
            return tx;
        } catch (RuntimeException e) {
            log.error("Verification of {}/{} failed unexpectedly", gateway.code(), paymentId, e);
            return tx;
        }

        if (verified.isEmpty() || verified.get() == PaymentStatus.PENDING) return tx;
        return confirmTransaction(gateway, paymentId, verified.get());
    }

    /**
     * Sweeps pending transactions older than {@code olderThan}.
     *
     * @return number of transactions that reached a terminal status
     */
    public int reconcilePending(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<PaymentTransaction> stale = transactions.findPendingOlderThan(cutoff, RECONCILE_BATCH);
        int settled = 0;
        for (PaymentTransaction tx : stale) {
            Optional<GatewayId> gateway = GatewayId.fromCode(tx.gateway());
            if (gateway.isEmpty() || gateway.get() == GatewayId.DEMO) continue;
            try {
                if (checkStatus(gateway.get(), tx.paymentId()).status().isTerminal()) settled++;
            } catch (RuntimeException e) {
                log.warn("Reconciliation of {}/{} failed: {}", tx.gateway(), tx.paymentId(), e.toString());
            }
        }
        if (!stale.isEmpty()) {
            log.info("Reconciled pending payments: checked={} settled={}", stale.size(), settled);
        }
        return settled;
    }

    /**
     * The catalog price in {@code currency} when the caller names no amount. A caller-supplied
     * amount may round up a checkout but never undercut the plan's USD price.
     */
    private BigDecimal chargeAmount(SubscriptionTier plan, BigDecimal requested, String currency) {
        BigDecimal price = TierCatalog.price(plan);
        if (requested == null) {
            return CurrencyConverter.USD.equals(currency) ? price : converter.fromUsd(price, currency);
        }
        if (requested.signum() <= 0) {
            throw new ValidationException("amount must be > 0");
        }
        if (!converter.covers(requested, currency, price)) {
            throw new ValidationException("amount is below the " + plan.code() + " price of " + price + " USD");
        }
        return requested;
    }

    private static SubscriptionTier requirePaidPlan(SubscriptionTier plan) {
        if (plan == null) {
            throw new ValidationException("plan is required");
        }
        if (plan == SubscriptionTier.FREE) {
            throw new ValidationException("free plan cannot be purchased");
        }
        return plan;
    }

    private static String normalizeCurrency(String currency) {
        if (currency == null || currency.isBlank()) return CurrencyConverter.USD;
        String c = currency.trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(c).matches()) {
            throw new ValidationException("Invalid currency: " + currency);
        }
        return c;
    }
}
