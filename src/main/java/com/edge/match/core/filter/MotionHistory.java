package com.edge.match.core.filter;

import com.edge.match.model.Point;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 每条轨迹的滚动位置缓冲
 * <p>
 * 条目在 frame - 最早帧 > window 时被裁掉
 */
public class MotionHistory {

    private final Map<String, Deque<Entry>> entries = new HashMap<>();

    public void record(String trackId, Point position, int frameNumber, int windowFrames) {
        Deque<Entry> buffer = entries.computeIfAbsent(trackId, id -> new ArrayDeque<>());
        buffer.addLast(new Entry(position, frameNumber));
        while (!buffer.isEmpty() && frameNumber - buffer.peekFirst().frameNumber > windowFrames) {
            buffer.pollFirst();
        }
    }

    public boolean hasHistory(String trackId) {
        Deque<Entry> buffer = entries.get(trackId);
        return buffer != null && !buffer.isEmpty();
    }

    /**
     * 窗口内累计位移
     */
    public double movement(String trackId) {
        return calculateMovement(positions(trackId));
    }

    public List<Point> positions(String trackId) {
        List<Point> points = new ArrayList<>();
        Deque<Entry> buffer = entries.get(trackId);
        if (buffer != null) {
            buffer.forEach(e -> points.add(e.position));
        }
        return points;
    }

    public List<Integer> frameNumbers(String trackId) {
        List<Integer> frames = new ArrayList<>();
        Deque<Entry> buffer = entries.get(trackId);
        if (buffer != null) {
            buffer.forEach(e -> frames.add(e.frameNumber));
        }
        return frames;
    }

    /**
     * 移除超过 maxStaleFrames 帧未出现的轨迹
     *
     * @return 移除的轨迹数
     */
    public int pruneStale(int currentFrame, int maxStaleFrames) {
        int removed = 0;
        Iterator<Map.Entry<String, Deque<Entry>>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Entry> buffer = it.next().getValue();
            int lastFrame = buffer.isEmpty() ? 0 : buffer.peekLast().frameNumber;
            if (currentFrame - lastFrame > maxStaleFrames) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /**
     * 相邻点欧几里得距离之和，空路径或单点路径为 0
     */
    public static double calculateMovement(List<Point> positions) {
        double total = 0;
        for (int i = 1; i < positions.size(); i++) {
            total += positions.get(i - 1).distanceTo(positions.get(i));
        }
        return total;
    }

    private static class Entry {
        final Point position;
        final int frameNumber;

        Entry(Point position, int frameNumber) {
            this.position = position;
            this.frameNumber = frameNumber;
        }
    }
}
