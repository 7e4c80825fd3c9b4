package work.pollochang.match.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 合併各比例的候選結果，去除重複後排序並截斷。
 *
 * <p>排序規則：信心分數高者優先；相同時比例大者優先，再依 x、y 由小到大。
 * 依此順序逐一檢查，下列情況捨棄 (該區域已由分數更高的結果涵蓋)：
 * <ul>
 *   <li>與任何已保留結果的 IoU 達到 {@link #DEDUP_THRESHOLD}。</li>
 *   <li>與已保留結果互相包含。</li>
 *   <li>完全落在任何排名更前的候選結果內，不論該結果是否被保留。</li>
 * </ul>
 * 最後一條讓兩個相鄰的相同樣板只留下一筆：第二個樣板因重疊被捨棄後，
 * 落在它裡面的較小比例結果也一併捨棄。
 */
@Slf4j
public final class CandidateAggregator {

    public static final double DEDUP_THRESHOLD = 0.3;

    public static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::confidence).reversed()
            .thenComparing(Comparator.comparingDouble(Candidate::scale).reversed())
            .thenComparingInt(Candidate::x)
            .thenComparingInt(Candidate::y);

    private CandidateAggregator() {}

    /**
     * @param candidates 所有比例的候選結果
     * @param limit      最多保留幾筆
     * @return 依 {@link #RANKING} 排序、最多 {@code limit} 筆的結果
     */
    public static List<Candidate> aggregate(Collection<Candidate> candidates, int limit) {
        List<Candidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING);

        List<Candidate> kept = new ArrayList<>();
        Footprints seen = new Footprints(ranked);
        for (Candidate candidate : ranked) {
            if (kept.size() >= limit) {
                break;
            }
            if (!seen.covers(candidate) && isDistinct(candidate, kept)) {
                kept.add(candidate);
            }
            seen.add(candidate);
        }
        log.debug("候選結果 {} 筆，去除重複後保留 {} 筆 (上限 {})", ranked.size(), kept.size(), limit);
        return kept;
    }

    private static boolean isDistinct(Candidate candidate, List<Candidate> kept) {
        for (Candidate other : kept) {
            if (candidate.iou(other) >= DEDUP_THRESHOLD || candidate.nested(other)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 已檢查過的候選結果，依尺寸分組記錄左上角位置。候選結果只有少數幾種尺寸
     * (每個比例一種)，查詢包含關係時只需掃描可能的左上角範圍。
     */
    private static final class Footprints {

        private final Map<Long, BitSet> bySize = new HashMap<>();
        private final int stride;

        Footprints(Collection<Candidate> candidates) {
            int maxX = 0;
            for (Candidate c : candidates) {
                maxX = Math.max(maxX, c.x());
            }
            this.stride = maxX + 1;
        }

        void add(Candidate c) {
            bySize.computeIfAbsent(sizeKey(c.width(), c.height()), key -> new BitSet())
                    .set(c.y() * stride + c.x());
        }

        /**
         * 是否有已記錄的矩形完全包含 {@code c}。
         */
        boolean covers(Candidate c) {
            for (Map.Entry<Long, BitSet> entry : bySize.entrySet()) {
                int width = (int) (entry.getKey() >>> 32);
                int height = (int) (long) entry.getKey();
                if (width < c.width() || height < c.height()) {
                    continue;
                }
                BitSet positions = entry.getValue();
                int fromX = Math.max(0, c.x() + c.width() - width);
                for (int y = Math.max(0, c.y() + c.height() - height); y <= c.y(); y++) {
                    int next = positions.nextSetBit(y * stride + fromX);
                    if (next >= 0 && next <= y * stride + c.x()) {
                        return true;
                    }
                }
            }
            return false;
        }

        private static long sizeKey(int width, int height) {
            return ((long) width << 32) | height;
        }
    }
}
