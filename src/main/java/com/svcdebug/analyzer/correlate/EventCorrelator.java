package com.svcdebug.analyzer.correlate;

import com.svcdebug.analyzer.config.AnalyzerProperties;
import com.svcdebug.analyzer.config.AnalyzerProperties.ClusteringMode;
import com.svcdebug.analyzer.model.*;
import com.svcdebug.analyzer.normalize.TimestampNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;

/**
 * 跨来源事件关联：把合并、排序后的 UnifiedEvent 按时间窗 + 相关性切成 CorrelationGroup，
 * 再算整体统计和时间线。
 *
 * 默认是“锚点”模式：每个事件做一次锚点，向后扫描到超出时间窗为止，
 * 与锚点相关的候选和锚点组成一组。同一事件可以出现在多个组里。
 * clustering=transitive 时改用 {@link TransitiveEventJoiner}，组之间不相交。
 *
 * 纯函数：不持有任何跨调用的可变状态，同样输入得到同样输出。
 */
@Component
@Slf4j
public class EventCorrelator {

    private static final double SIZE_WEIGHT_CAP = 0.4;
    private static final double SOURCE_WEIGHT_CAP = 0.3;
    private static final double SINGLE_SERVICE_BONUS = 0.3;
    private static final int HOVER_TEXT_LIMIT = 100;

    private final RelatednessStrategy relatedness;
    private final ClusteringMode clusteringMode;
    private final Duration defaultWindow;

    public EventCorrelator(RelatednessStrategy relatedness, AnalyzerProperties properties) {
        this.relatedness = relatedness;
        this.clusteringMode = properties.getCorrelation().getClustering();
        this.defaultWindow = properties.getCorrelation().getTimeWindow();
    }

    public Duration getDefaultWindow() {
        return defaultWindow;
    }

    public CorrelationResult correlate(List<UnifiedEvent> events) {
        return correlate(events, defaultWindow);
    }

    /**
     * @param events 四个来源合并后的事件，可以未排序，可以含没有时间戳的事件
     * @param window 时间窗，>= 0
     */
    public CorrelationResult correlate(List<UnifiedEvent> events, Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Correlation window must be >= 0, got " + window);
        }
        List<UnifiedEvent> all = events == null ? List.of() : events;

        // 没有时间戳的事件无法放进确定的时间窗，只参与统计
        List<UnifiedEvent> sorted = all.stream()
                .filter(UnifiedEvent::hasTimestamp)
                .sorted(Comparator.comparing(UnifiedEvent::getTimestamp))
                .toList();

        List<List<UnifiedEvent>> clusters = clusteringMode == ClusteringMode.TRANSITIVE
                ? new TransitiveEventJoiner(relatedness).join(sorted, window)
                : anchorClusters(sorted, window);

        List<CorrelationGroup> groups = new ArrayList<>(clusters.size());
        for (List<UnifiedEvent> members : clusters) {
            groups.add(buildGroup(groups.size() + 1, members));
        }

        CorrelationStatistics stats = buildStatistics(groups, all, sorted);
        log.debug("Correlated {} timestamped of {} events into {} groups (window={}ms, mode={})",
                sorted.size(), all.size(), groups.size(), window.toMillis(), clusteringMode);

        return CorrelationResult.builder()
                .groups(List.copyOf(groups))
                .statistics(stats)
                .timeline(buildTimeline(groups))
                .build();
    }

    private List<List<UnifiedEvent>> anchorClusters(List<UnifiedEvent> sorted, Duration window) {
        List<List<UnifiedEvent>> clusters = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            UnifiedEvent anchor = sorted.get(i);
            List<UnifiedEvent> members = new ArrayList<>();
            members.add(anchor);

            for (int j = i + 1; j < sorted.size(); j++) {
                UnifiedEvent candidate = sorted.get(j);
                if (beyondWindow(anchor, candidate, window)) {
                    break;  // 已排序，后面只会更远
                }
                if (relatedness.related(anchor, candidate)) {
                    members.add(candidate);
                }
            }

            if (members.size() > 1) {
                clusters.add(members);
            }
        }
        return clusters;
    }

    static boolean beyondWindow(UnifiedEvent anchor, UnifiedEvent candidate, Duration window) {
        return Duration.between(anchor.getTimestamp(), candidate.getTimestamp()).abs().compareTo(window) > 0;
    }

    private CorrelationGroup buildGroup(int id, List<UnifiedEvent> members) {
        Set<EventSource> sources = EnumSet.noneOf(EventSource.class);
        Set<String> serviceIds = new LinkedHashSet<>();
        LocalDateTime first = null;
        LocalDateTime last = null;

        for (UnifiedEvent e : members) {
            sources.add(e.getSource());
            if (e.hasServiceId()) {
                serviceIds.add(e.getServiceId());
            }
            LocalDateTime ts = e.getTimestamp();
            if (first == null || ts.isBefore(first)) first = ts;
            if (last == null || ts.isAfter(last)) last = ts;
        }

        return CorrelationGroup.builder()
                .id(id)
                .events(List.copyOf(members))
                .timeSpanMs(toMillis(Duration.between(first, last)))
                .sourcesInvolved(Collections.unmodifiableSet(sources))
                .serviceIdsInvolved(Collections.unmodifiableSet(serviceIds))
                .strength(strength(members.size(), sources.size(), serviceIds.size()))
                .build();
    }

    /**
     * size、来源多样性、serviceId 一致性三项各自封顶，总分封顶 1.0。
     * 一致性只看非 null 的 serviceId：恰好只有一种时加分。
     */
    static double strength(int size, int distinctSources, int distinctServiceIds) {
        if (size < 2) {
            return 0.0;
        }
        double s = Math.min(size / 5.0, SIZE_WEIGHT_CAP)
                + Math.min(distinctSources / 4.0, SOURCE_WEIGHT_CAP)
                + (distinctServiceIds == 1 ? SINGLE_SERVICE_BONUS : 0.0);
        return Math.min(s, 1.0);
    }

    private CorrelationStatistics buildStatistics(List<CorrelationGroup> groups,
                                                  List<UnifiedEvent> all,
                                                  List<UnifiedEvent> sorted) {
        Set<EventSource> sources = EnumSet.noneOf(EventSource.class);
        all.forEach(e -> sources.add(e.getSource()));

        // 同一个事件可能在多个组里，按对象身份去重
        Set<UnifiedEvent> correlated = Collections.newSetFromMap(new IdentityHashMap<>());
        int memberships = 0;
        // 按组 id 顺序记录首次出现的先后，并列时取最先出现的服务
        Map<String, Integer> serviceGroupCounts = new LinkedHashMap<>();
        for (CorrelationGroup g : groups) {
            correlated.addAll(g.getEvents());
            memberships += g.size();
            for (String sid : g.getServiceIdsInvolved()) {
                serviceGroupCounts.merge(sid, 1, Integer::sum);
            }
        }

        String mostActive = null;
        int best = 0;
        for (var entry : serviceGroupCounts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                mostActive = entry.getKey();
            }
        }

        String earliest = sorted.isEmpty() ? null : TimestampNormalizer.format(sorted.get(0).getTimestamp());
        String latest = sorted.isEmpty() ? null : TimestampNormalizer.format(sorted.get(sorted.size() - 1).getTimestamp());

        return CorrelationStatistics.builder()
                .totalGroups(groups.size())
                .avgEventsPerGroup(groups.isEmpty() ? 0.0 : round2((double) memberships / groups.size()))
                .mostActiveService(mostActive)
                .earliest(earliest)
                .latest(latest)
                .timeRange(earliest == null ? null : earliest + " - " + latest)
                .sourcesInvolved(Collections.unmodifiableSet(sources))
                .totalEvents(all.size())
                .timestampedEvents(sorted.size())
                .correlatedEvents(correlated.size())
                .groupMemberships(memberships)
                .correlationRate(sorted.isEmpty() ? 0.0 : round2(correlated.size() * 100.0 / sorted.size()))
                .build();
    }

    /**
     * 每个组的每个成员一个点，y 为组在列表中的下标。
     */
    private List<TimelinePoint> buildTimeline(List<CorrelationGroup> groups) {
        List<TimelinePoint> points = new ArrayList<>();
        for (int i = 0; i < groups.size(); i++) {
            CorrelationGroup g = groups.get(i);
            for (UnifiedEvent e : g.getEvents()) {
                String sid = e.getServiceId();
                points.add(TimelinePoint.builder()
                        .x(TimestampNormalizer.isoFormat(e.getTimestamp()))
                        .y(i)
                        .text(e.getSource() + ": " + (sid == null ? "N/A" : sid))
                        .hoverText(abbreviate(e.getMessage()))
                        .source(e.getSource())
                        .serviceId(sid)
                        .correlationId(g.getId())
                        .build());
            }
        }
        return List.copyOf(points);
    }

    private static String abbreviate(String message) {
        String head = message.length() > HOVER_TEXT_LIMIT ? message.substring(0, HOVER_TEXT_LIMIT) : message;
        return head + "...";
    }

    private static double toMillis(Duration d) {
        return d.toNanos() / 1_000_000.0;
    }

    static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
