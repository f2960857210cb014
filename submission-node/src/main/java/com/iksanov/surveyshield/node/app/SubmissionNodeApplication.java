package com.iksanov.surveyshield.node.app;

import com.iksanov.surveyshield.common.dto.DssStatus;
import com.iksanov.surveyshield.common.dto.ServiceResult;
import com.iksanov.surveyshield.node.anonymization.PassThroughTextAnonymizer;
import com.iksanov.surveyshield.node.config.ApplicationConfig;
import com.iksanov.surveyshield.node.election.LeaderElector;
import com.iksanov.surveyshield.node.election.LeadershipChange;
import com.iksanov.surveyshield.node.election.LeaseLeaderElector;
import com.iksanov.surveyshield.node.election.SingleInstanceLeaderElector;
import com.iksanov.surveyshield.node.election.lease.PostgresLeaseStore;
import com.iksanov.surveyshield.node.event.EventChannel;
import com.iksanov.surveyshield.node.http.HttpServer;
import com.iksanov.surveyshield.node.http.admin.AdminStatusHandler;
import com.iksanov.surveyshield.node.http.admin.StaticTokenAdminAuthenticator;
import com.iksanov.surveyshield.node.metrics.ElectionMetrics;
import com.iksanov.surveyshield.node.metrics.SubmissionMetrics;
import com.iksanov.surveyshield.node.persistence.DataSourceFactory;
import com.iksanov.surveyshield.node.persistence.PostgresResponseRepository;
import com.iksanov.surveyshield.node.persistence.PostgresSurveyCloser;
import com.iksanov.surveyshield.node.submission.*;
import com.iksanov.surveyshield.node.transfer.InstanceCommunicationHandler;
import com.iksanov.surveyshield.node.transfer.LeaderRoutedSurveyCloser;
import com.iksanov.surveyshield.node.transfer.NettyLeaderTransport;
import com.iksanov.surveyshield.node.transfer.TransferClient;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main application class for a submission node.
 * Runs alone (always leader) or scaled out, with leadership decided through a lease row in Postgres.
 */
public class SubmissionNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(SubmissionNodeApplication.class);
    private static final String LEASE_NAME = "dss-leader";
    private final ApplicationConfig config;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private HikariDataSource dataSource;
    private LeaderElector elector;
    private EventChannel<LeadershipChange> leadershipChanges;
    private EventChannel<DssStatus> statusChanges;
    private NettyLeaderTransport transport;
    private ExecutorService transferExecutor;
    private DelayedSubmissionService submissionService;
    private HttpServer httpServer;

    public SubmissionNodeApplication(ApplicationConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        ApplicationConfig config = ApplicationConfig.fromEnv();

        log.info("========================================");
        log.info("Starting SubmissionNode: {}", config.self().instanceId());
        log.info("Scale-out: {}, Port: {}", config.election().scaleOut(), config.self().port());
        log.info("========================================");

        SubmissionNodeApplication app = new SubmissionNodeApplication(config);
        app.start();
        app.awaitShutdown();
    }

    public void start() {
        try {
            Clock clock = Clock.systemUTC();
            SecureRandom random = new SecureRandom();
            String instanceId = config.self().instanceId();

            PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
            ElectionMetrics electionMetrics = new ElectionMetrics(registry);
            SubmissionMetrics submissionMetrics = new SubmissionMetrics(registry);
            log.info("[OK] Metrics initialized");

            dataSource = DataSourceFactory.create(config.dbUrl(), config.dbUser(), config.dbPassword(), config.dbPoolSize());
            log.info("[OK] DataSource initialized (pool={})", config.dbPoolSize());

            leadershipChanges = EventChannel.async("leadership");
            statusChanges = EventChannel.async("dss-status");
            elector = config.election().scaleOut()
                    ? new LeaseLeaderElector(instanceId, new PostgresLeaseStore(dataSource, LEASE_NAME), config.election(), clock, leadershipChanges, electionMetrics)
                    : new SingleInstanceLeaderElector(instanceId, leadershipChanges, clock);
            log.info("[OK] Leader election configured ({})", config.election());

            SubmissionQueue queue = new SubmissionQueue(config.dss().minPercentage());
            FlushPlanner planner = new FlushPlanner(config.dss().minimumSurveySubmissions(), random);
            PostgresResponseRepository repository = new PostgresResponseRepository(dataSource);
            ResponseSubmitter submitter = new ResponseSubmitter(repository, new PassThroughTextAnonymizer(), submissionMetrics);
            DelayScheduler scheduler = new DelayScheduler(queue, planner, submitter, repository, elector, config.dss(), random, clock,
                    submissionMetrics, DelayScheduler.newTimer(instanceId));

            transport = new NettyLeaderTransport(config.instanceSecret(), config.transferTimeout());
            transferExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("leader-transfer-" + instanceId);
                thread.setDaemon(true);
                return thread;
            });
            TransferClient transferClient = new TransferClient(elector, transport, queue, submissionMetrics, transferExecutor,
                    scheduler::armCold);

            submissionService = new DelayedSubmissionService(elector, queue, scheduler, submitter, planner, transferClient, config.dss(),
                    clock, submissionMetrics, statusChanges);
            statusChanges.subscribe(status -> log.debug("DSS status: pending={}, leader={}, next={}", status.pending(), status.leader(), status.nextFlushTime()));
            new LeadershipTransitionHandler(scheduler, queue, transferClient, submissionService::publishStatus).register(leadershipChanges);
            submissionService.start();
            log.info("[OK] Delayed submission service initialized ({})", config.dss());

            elector.start();
            if (!elector.awaitReady(config.election().leaseTimeout())) log.warn("Leader election not ready yet, continuing startup");
            log.info("[OK] Leader election started (leader={})", elector.isLeader());

            if (!elector.isLeader()) {
                ServiceResult<Boolean> verification = transferClient.verifyLeaderCommunication();
                if (!verification.successful()) {
                    throw new IllegalStateException("Cannot reach the leader: " + verification.message());
                }
                log.info("[OK] Leader communication verified");
            }

            PostgresSurveyCloser surveyCloser = new PostgresSurveyCloser(dataSource, submissionService);
            InstanceCommunicationHandler instanceHandler = new InstanceCommunicationHandler(config.instanceSecret(), elector, submissionService, surveyCloser);
            LeaderRoutedSurveyCloser adminCloser = new LeaderRoutedSurveyCloser(elector, surveyCloser, transferClient);
            AdminStatusHandler adminHandler = new AdminStatusHandler(new StaticTokenAdminAuthenticator(config.adminToken()), submissionService, adminCloser,
                    clock, config.self().host());
            httpServer = new HttpServer(config.toHttpServerConfig(), instanceHandler, adminHandler, registry::scrape);
            httpServer.start();
            log.info("[OK] Server listening on {}:{}", config.bindHost(), config.self().port());

            Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

            log.info("========================================");
            log.info("[SUCCESS] SubmissionNode ready!");
            log.info("  Instance: {}", instanceId);
            log.info("  Leader: {}", elector.isLeader());
            log.info("========================================");

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Startup interrupted");
            shutdown();
            System.exit(1);
        } catch (Exception e) {
            log.error("Startup failed", e);
            shutdown();
            System.exit(1);
        }
    }

    private void shutdown() {
        if (shutdownLatch.getCount() == 0) return;
        log.info("========================================");
        log.info("Shutting down SubmissionNode...");
        log.info("========================================");

        try {
            if (httpServer != null && httpServer.isRunning()) {
                log.info("Stopping HttpServer...");
                httpServer.stop();
                log.info("[OK] HttpServer stopped");
            }

            if (submissionService != null) {
                log.info("Stopping delayed submission service...");
                submissionService.shutdown();
                log.info("[OK] Delayed submission service stopped");
            }

            if (elector != null) {
                log.info("Stopping leader election...");
                elector.stop();
                log.info("[OK] Leader election stopped");
            }

            if (transferExecutor != null) {
                transferExecutor.shutdown();
                if (!transferExecutor.awaitTermination(2, TimeUnit.SECONDS)) transferExecutor.shutdownNow();
            }
            if (transport != null) transport.close();
            if (leadershipChanges != null) leadershipChanges.close();
            if (statusChanges != null) statusChanges.close();

            if (dataSource != null) {
                log.info("Closing DataSource...");
                dataSource.close();
                log.info("[OK] DataSource closed");
            }

            log.info("========================================");
            log.info("[SUCCESS] Shutdown complete");
            log.info("========================================");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted during shutdown");
        } catch (Exception e) {
            log.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
