package com.ryuqq.procexec.adapter.runner;

import java.util.HashSet;
import java.util.Set;

/**
 * 출력 수집 스레드(procexec-stream-*) 조회 헬퍼.
 */
final class StreamThreads {

    private static final String PREFIX = "procexec-stream-";
    private static final long WAIT_MS = 2000;

    private StreamThreads() {
    }

    static Set<Thread> alive() {
        Set<Thread> threads = new HashSet<>();
        for (Thread thread : Thread.getAllStackTraces().keySet()) {
            if (thread.isAlive() && thread.getName().startsWith(PREFIX)) {
                threads.add(thread);
            }
        }
        return threads;
    }

    /**
     * before 이후 생긴 스레드가 모두 끝날 때까지 잠시 대기.
     *
     * @param before 비교 기준 스레드 집합
     * @return 대기 후에도 살아 있는 새 스레드
     */
    static Set<Thread> awaitNoneBeyond(Set<Thread> before) throws InterruptedException {
        long deadline = System.currentTimeMillis() + WAIT_MS;
        Set<Thread> remaining = beyond(before);
        while (!remaining.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            remaining = beyond(before);
        }
        return remaining;
    }

    private static Set<Thread> beyond(Set<Thread> before) {
        Set<Thread> current = alive();
        current.removeAll(before);
        return current;
    }
}
