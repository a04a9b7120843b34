package com.bazaarvoice.rbac;

import com.bazaarvoice.rbac.api.PermissionChecker;
import com.bazaarvoice.rbac.audit.AsyncAuditEmitter;
import com.bazaarvoice.rbac.audit.AuditEmitter;
import com.bazaarvoice.rbac.audit.AuditSink;
import com.bazaarvoice.rbac.audit.CacheInvalidationAuditor;
import com.bazaarvoice.rbac.audit.DiscardingAuditEmitter;
import com.bazaarvoice.rbac.audit.LoggingAuditSink;
import com.bazaarvoice.rbac.boundary.EntityBoundaryValidator;
import com.bazaarvoice.rbac.cache.PermissionCache;
import com.bazaarvoice.rbac.cache.StoreChangeInvalidator;
import com.bazaarvoice.rbac.config.PermissionEngineConfiguration;
import com.bazaarvoice.rbac.dependency.DependencyResolver;
import com.bazaarvoice.rbac.dependency.DependencyRulesLoader;
import com.bazaarvoice.rbac.resolver.DefaultPermissionChecker;
import com.bazaarvoice.rbac.resolver.PermissionGrantValidator;
import com.bazaarvoice.rbac.store.PermissionStore;
import com.bazaarvoice.rbac.store.StoreChangeNotifier;
import com.codahale.metrics.MetricRegistry;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.dropwizard.lifecycle.ExecutorServiceManager;
import io.dropwizard.lifecycle.setup.LifecycleEnvironment;
import io.dropwizard.util.Duration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Guice module for constructing a {@link PermissionChecker}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link PermissionEngineConfiguration}
 * <li> {@link PermissionStore}
 * <li> {@link StoreChangeNotifier} for the same store
 * <li> {@link MetricRegistry}
 * <li> {@link Clock}
 * <li> Dropwizard {@link LifecycleEnvironment}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link PermissionChecker}
 * <li> {@link DefaultPermissionChecker}
 * <li> {@link PermissionGrantValidator}
 * <li> {@link PermissionCache}
 * <li> {@link DependencyResolver}
 * <li> {@link AuditEmitter}
 * </ul>
 */
public class PermissionEngineModule extends PrivateModule {

    private final AuditSink _auditSink;

    public PermissionEngineModule() {
        this(new LoggingAuditSink());
    }

    public PermissionEngineModule(AuditSink auditSink) {
        _auditSink = checkNotNull(auditSink, "auditSink");
    }

    @Override
    protected void configure() {
        bind(AuditSink.class).toInstance(_auditSink);

        expose(PermissionChecker.class);
        expose(DefaultPermissionChecker.class);
        expose(PermissionGrantValidator.class);
        expose(PermissionCache.class);
        expose(DependencyResolver.class);
        expose(AuditEmitter.class);
    }

    @Provides @Singleton
    DependencyRulesLoader provideDependencyRulesLoader(PermissionStore store, PermissionEngineConfiguration config) {
        return new DependencyRulesLoader(store, config.getDependencyRules());
    }

    /** Fails injector creation if the rule table is broken. */
    @Provides @Singleton
    DependencyResolver provideDependencyResolver(DependencyRulesLoader rulesLoader) {
        return rulesLoader.newResolver();
    }

    @Provides @Singleton
    EntityBoundaryValidator provideEntityBoundaryValidator(Clock clock) {
        return new EntityBoundaryValidator(clock);
    }

    @Provides @Singleton
    AuditEmitter provideAuditEmitter(PermissionEngineConfiguration config, AuditSink sink,
                                     MetricRegistry metricRegistry, LifecycleEnvironment lifecycle) {
        if (!config.getAudit().isEnabled()) {
            return new DiscardingAuditEmitter();
        }
        AsyncAuditEmitter emitter = new AsyncAuditEmitter(sink, config.getAudit().getQueueCapacity(), metricRegistry);
        lifecycle.manage(emitter);
        return emitter;
    }

    /** Wires store writes to cache invalidation and cache invalidations to the audit stream. */
    @Provides @Singleton
    PermissionCache providePermissionCache(PermissionEngineConfiguration config, Clock clock, MetricRegistry metricRegistry,
                                           AuditEmitter auditEmitter, StoreChangeNotifier notifier,
                                           DependencyResolver dependencyResolver, DependencyRulesLoader rulesLoader) {
        PermissionCache cache = new PermissionCache(config.getCache(), clock, metricRegistry);
        cache.addListener(new CacheInvalidationAuditor(auditEmitter, clock));
        notifier.addListener(new StoreChangeInvalidator(cache, dependencyResolver, rulesLoader));
        return cache;
    }

    @Provides @Singleton
    ListeningExecutorService provideStoreExecutor(PermissionEngineConfiguration config, LifecycleEnvironment lifecycle) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getStoreThreads(),
                new ThreadFactoryBuilder().setNameFormat("permission-store-%d").setDaemon(true).build());
        lifecycle.manage(new ExecutorServiceManager(executor, Duration.seconds(5), "permission-store"));
        return MoreExecutors.listeningDecorator(executor);
    }

    @Provides @Singleton
    DefaultPermissionChecker provideDefaultPermissionChecker(PermissionEngineConfiguration config, PermissionStore store,
                                                             PermissionCache cache, DependencyResolver dependencyResolver,
                                                             EntityBoundaryValidator boundaryValidator, AuditEmitter auditEmitter,
                                                             ListeningExecutorService storeExecutor, Clock clock,
                                                             MetricRegistry metricRegistry) {
        return new DefaultPermissionChecker(store, cache, dependencyResolver, boundaryValidator, auditEmitter,
                storeExecutor, clock, java.time.Duration.ofMillis(config.getCheckTimeout().toMilliseconds()), metricRegistry);
    }

    @Provides @Singleton
    PermissionChecker providePermissionChecker(DefaultPermissionChecker checker) {
        return checker;
    }

    @Provides @Singleton
    PermissionGrantValidator providePermissionGrantValidator(PermissionEngineConfiguration config,
                                                             DefaultPermissionChecker checker, Clock clock) {
        return new PermissionGrantValidator(checker, clock,
                java.time.Duration.ofMillis(config.getCheckTimeout().toMilliseconds()));
    }
}
