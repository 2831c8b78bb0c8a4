package com.webcrawler.core.crawler;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * 중복 제거 집합(seen) + 용량 고정 FIFO 큐(pending).
 *
 * 입장은 seen.add(원자적 insert-if-absent)의 승자만 큐에 넣는다 → URL당 최대 1회 입장.
 * seen은 실행 동안 줄어들지 않는다. 메모리 상한은 maxUrls에 비례(퇴출하면 최대 1회 보장이 깨짐).
 * 큐가 가득 차 버려진 URL도 seen에 남으므로 그 실행에서는 다시 입장하지 못한다.
 */
public final class Frontier {

    public enum Admission { ADMITTED, DUPLICATE, DROPPED }

    private static final long SEED_OFFER_SLICE_MS = 50;

    private final Set<String> seen = ConcurrentHashMap.newKeySet();
    private final BlockingQueue<String> pending;
    private final int capacity;
    // 입장했지만 아직 처리 완료되지 않은 URL 수 (큐 + 워커 손안)
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile boolean closed = false;

    public Frontier(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
        this.pending = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 시드용: 자리가 날 때까지 대기(취소 가능). 시드는 잃어버리면 안 된다.
     * @return 새로 입장했으면 true, 이미 본 URL이면 false
     * @throws CancellationException 대기 중 취소
     */
    public boolean admitBlocking(String url, BooleanSupplier cancelled) throws InterruptedException {
        if (closed) return false;
        if (!seen.add(url)) return false;
        inFlight.incrementAndGet();
        while (true) {
            if (cancelled.getAsBoolean() || closed) {
                inFlight.decrementAndGet();
                throw new CancellationException("cancelled while queueing " + url);
            }
            try {
                if (pending.offer(url, SEED_OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) return true;
            } catch (InterruptedException ie) {
                inFlight.decrementAndGet();
                throw ie;
            }
        }
    }

    /**
     * 발견 링크용: 절대 블록하지 않는다. 큐가 가득 차면 버린다(DROPPED).
     * 큐가 포화인데 워커가 모두 입장 대기로 막히면 풀 전체가 교착되므로.
     */
    public Admission tryAdmit(String url) {
        if (closed) return Admission.DROPPED;
        if (!seen.add(url)) return Admission.DUPLICATE;
        inFlight.incrementAndGet();
        if (pending.offer(url)) return Admission.ADMITTED;
        inFlight.decrementAndGet();
        return Admission.DROPPED;
    }

    /**
     * 다음 URL. 비어 있으면 pollInterval 단위로 기다리며 취소/close를 확인한다.
     * @return 취소됐거나 닫히고 비었으면 null
     */
    public String take(Duration pollInterval, BooleanSupplier cancelled) throws InterruptedException {
        long sliceMs = Math.max(1, pollInterval.toMillis());
        while (!cancelled.getAsBoolean()) {
            String url = pending.poll(sliceMs, TimeUnit.MILLISECONDS);
            if (url != null) return url;
            if (closed && pending.isEmpty()) return null;
        }
        return null;
    }

    /** take()로 받은 URL 하나의 처리가 끝났음(처리 안 하고 버린 경우 포함) */
    public void complete() {
        inFlight.decrementAndGet();
    }

    /** 더 이상 입장/전송 없음. 대기 중인 take는 큐가 비면 null을 돌려준다. */
    public void close() { closed = true; }

    /** 대기 큐 길이 */
    public int size() { return pending.size(); }

    public int capacity() { return capacity; }

    public int seenCount() { return seen.size(); }

    public boolean hasSeen(String url) { return seen.contains(url); }

    public int inFlight() { return inFlight.get(); }

    /** 큐가 비었고 워커 손에 든 URL도 없음 */
    public boolean isDrained() {
        return inFlight.get() <= 0 && pending.isEmpty();
    }
}
