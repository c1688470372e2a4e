package com.mercuri.vault.runtime;

import com.mercuri.vault.core.event.VaultEvent;
import com.mercuri.vault.core.spi.VaultEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 작업 단위 알림 버퍼.
 *
 * <p>작업 중 발생한 알림을 모아 두었다가 커밋 시에만 전달합니다.
 * 되돌려진 작업의 알림은 전달되지 않습니다.</p>
 */
final class EventBuffer {

    private static final Logger log = LoggerFactory.getLogger(EventBuffer.class);

    private final VaultEventListener listener;
    private final List<VaultEvent> pending = new ArrayList<>();

    EventBuffer(VaultEventListener listener) {
        this.listener = listener;
    }

    void emit(VaultEvent event) {
        pending.add(event);
    }

    void discard() {
        pending.clear();
    }

    /**
     * 커밋된 알림 전달.
     *
     * <p>알림은 관측용이므로 수신자 오류가 이미 커밋된 작업을 실패시키지 않습니다.</p>
     */
    void flush() {
        List<VaultEvent> committed = new ArrayList<>(pending);
        pending.clear();
        for (VaultEvent event : committed) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Event listener failed for {}", event, e);
            }
        }
    }
}
