package probe;

import model.ProbeDescriptor;
import model.ProbeResult;

/**
 * Событие завершения одной проверки.
 *
 * @param descriptor дескриптор, породивший результат
 * @param submissionIndex порядковый номер дескриптора в исходной последовательности (с 0)
 * @param result результат проверки
 * @param completed сколько проверок завершено, включая эту
 * @param total общее число проверок
 */
public record ProbeEvent(ProbeDescriptor descriptor, long submissionIndex, ProbeResult result,
                         long completed, long total) {

    /**
     * @return процент завершенных проверок, 0..100
     */
    public double percentComplete() {
        return total > 0 ? completed * 100.0 / total : 100.0;
    }
}
