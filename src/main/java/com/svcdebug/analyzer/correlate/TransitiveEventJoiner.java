package com.svcdebug.analyzer.correlate;

import com.svcdebug.analyzer.model.UnifiedEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 传递闭包式分组（analyzer.correlation.clustering=transitive）：
 * - 相关性判断和时间窗与锚点模式完全一样
 * - A~B、B~C 时 A、B、C 归为同一组，组之间互不相交
 *
 * 输入必须已按时间升序排好，且不含没有时间戳的事件。
 * 输出按每组最早成员的先后排列，只保留 size >= 2 的组。
 */
public class TransitiveEventJoiner {

    private final RelatednessStrategy relatedness;

    public TransitiveEventJoiner(RelatednessStrategy relatedness) {
        this.relatedness = relatedness;
    }

    public List<List<UnifiedEvent>> join(List<UnifiedEvent> sorted, Duration window) {
        int n = sorted.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }

        // 简单 DSU 实现，按下标合并
        class DSU {
            int find(int x) {
                int root = x;
                while (parent[root] != root) {
                    root = parent[root];
                }
                // 路径压缩
                while (parent[x] != root) {
                    int next = parent[x];
                    parent[x] = root;
                    x = next;
                }
                return root;
            }

            void union(int a, int b) {
                int ra = find(a);
                int rb = find(b);
                if (ra == rb) {
                    return;
                }
                // 小下标做根，保证组的“发现顺序”就是最早成员的顺序
                if (ra < rb) {
                    parent[rb] = ra;
                } else {
                    parent[ra] = rb;
                }
            }
        }
        DSU dsu = new DSU();

        for (int i = 0; i < n; i++) {
            UnifiedEvent anchor = sorted.get(i);
            for (int j = i + 1; j < n; j++) {
                UnifiedEvent candidate = sorted.get(j);
                if (EventCorrelator.beyondWindow(anchor, candidate, window)) {
                    break;
                }
                if (relatedness.related(anchor, candidate)) {
                    dsu.union(i, j);
                }
            }
        }

        Map<Integer, List<UnifiedEvent>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            buckets.computeIfAbsent(dsu.find(i), k -> new ArrayList<>()).add(sorted.get(i));
        }

        List<List<UnifiedEvent>> groups = new ArrayList<>();
        for (List<UnifiedEvent> members : buckets.values()) {
            if (members.size() >= 2) {
                groups.add(members);
            }
        }
        return groups;
    }
}
