package com.qqsuccubus.faultlab.experiment.probe;

import com.qqsuccubus.faultlab.core.model.NodeDescriptor;
import com.qqsuccubus.faultlab.core.spi.IClusterTopology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.TimeoutException;

/**
 * Waits until the cluster reports the expected number of reachable nodes.
 */
public class ClusterReadinessWaiter {
    private static final Logger log = LoggerFactory.getLogger(ClusterReadinessWaiter.class);

    private final IClusterTopology topology;
    private final Duration pollInterval;

    public ClusterReadinessWaiter(IClusterTopology topology, Duration pollInterval) {
        this.topology = topology;
        this.pollInterval = pollInterval;
    }

    /**
     * @return Mono emitting true once {@code expectedNodes} nodes are up, false on timeout
     */
    public Mono<Boolean> waitForNodes(int expectedNodes, Duration maxWait) {
        log.info("Waiting for cluster to have {} nodes ready...", expectedNodes);

        return Flux.interval(Duration.ZERO, pollInterval)
            .onBackpressureDrop()
            .concatMap(tick -> Mono.fromCallable(topology::allNodes)
                .subscribeOn(Schedulers.boundedElastic()))
            .filter(nodes -> {
                long up = nodes.stream().filter(NodeDescriptor::isReachable).count();
                log.info("Cluster status: {}/{} nodes up", up, nodes.size());
                return up >= expectedNodes;
            })
            .next()
            .doOnNext(this::logNodes)
            .map(nodes -> true)
            .timeout(maxWait)
            .onErrorResume(TimeoutException.class, e -> {
                log.error("Cluster did not reach {} nodes within {}s", expectedNodes, maxWait.toSeconds());
                return Mono.just(false);
            });
    }

    private void logNodes(Collection<NodeDescriptor> nodes) {
        log.info("Cluster is ready");
        for (NodeDescriptor node : nodes) {
            log.info("  Node: {} ({}/{}) up={}",
                node.getPrimaryAddress(), node.getDatacenter(), node.getRack(), node.isReachable());
        }
    }
}
