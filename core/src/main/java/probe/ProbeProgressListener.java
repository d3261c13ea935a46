package probe;

/**
 * Слушатель прогресса запуска проверок.
 * Все методы вызываются из потока, запустившего {@link ProbeScheduler#run}.
 */
public interface ProbeProgressListener {

    /**
     * Вызывается до запуска первой проверки.
     *
     * @param totalAttempts общее число попыток
     */
    void onRunStart(long totalAttempts);

    /**
     * Вызывается по мере завершения каждой проверки, в порядке завершения.
     */
    void onProbeComplete(ProbeEvent event);

    /**
     * Вызывается после завершения всех проверок.
     *
     * @param successful число успешных проверок
     * @param durationSeconds продолжительность запуска в секундах
     */
    void onRunComplete(long successful, long durationSeconds);

    /**
     * Пустая реализация без операций.
     */
    static ProbeProgressListener noOp() {
        return new ProbeProgressListener() {
            @Override
            public void onRunStart(long totalAttempts) {}

            @Override
            public void onProbeComplete(ProbeEvent event) {}

            @Override
            public void onRunComplete(long successful, long durationSeconds) {}
        };
    }
}
