package io.horizen.drivechain.selection;

import com.google.common.primitives.UnsignedBytes;
import io.horizen.drivechain.model.SidechainObject;
import io.horizen.drivechain.model.WithdrawalBundle;
import io.horizen.drivechain.model.WithdrawalRequest;
import io.horizen.drivechain.model.WithdrawalStatus;
import io.horizen.drivechain.settings.BundleSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Ordering and filtering of withdrawal requests and bundles used to build bundles and to track their status.
 * Sorting and latest bundle lookup break ties by the object hash, so every node gets the same result
 * whatever the order of the input collection is.
 * Callers must not modify the lists concurrently with these operations.
 */
public final class WithdrawalSelector {
    private static final Logger log = LogManager.getLogger(WithdrawalSelector.class);

    private static final Comparator<byte[]> HASH_ORDER = UnsignedBytes.lexicographicalComparator();

    // Highest mainchain fee first.
    public static final Comparator<WithdrawalRequest> FEE_PRIORITY_ORDER =
            Comparator.comparingLong(WithdrawalRequest::mainchainFee).reversed();

    // Most recent bundle first.
    public static final Comparator<WithdrawalBundle> RECENCY_ORDER =
            Comparator.comparingInt(WithdrawalBundle::height).reversed();

    private WithdrawalSelector() {}

    // Equal fees are ordered by ascending hash.
    public static void sortByFee(List<WithdrawalRequest> requests) {
        sortWithHashTieBreak(requests, FEE_PRIORITY_ORDER);
    }

    // Equal heights are ordered by ascending hash.
    public static void sortByHeight(List<WithdrawalBundle> bundles) {
        sortWithHashTieBreak(bundles, RECENCY_ORDER);
    }

    // Keeps Unspent requests only, in their current order.
    public static void selectUnspent(List<WithdrawalRequest> requests) {
        requests.removeIf(request -> request.status() != WithdrawalStatus.Unspent);
    }

    public static Map<Integer, WithdrawalBundle> latestBundlePerSidechain(Collection<WithdrawalBundle> bundles) {
        Map<Integer, WithdrawalBundle> latest = new TreeMap<>();
        for (WithdrawalBundle bundle : bundles)
            latest.merge(bundle.sidechainNumber(), bundle, WithdrawalSelector::moreRecent);
        return latest;
    }

    private static WithdrawalBundle moreRecent(WithdrawalBundle current, WithdrawalBundle candidate) {
        int order = RECENCY_ORDER.compare(candidate, current);
        if (order == 0)
            order = HASH_ORDER.compare(candidate.hash(), current.hash());
        return order < 0 ? candidate : current;
    }

    // Hashes are computed once per element.
    private static <T extends SidechainObject> void sortWithHashTieBreak(List<T> items, Comparator<? super T> order) {
        List<HashedObject<T>> hashed = new ArrayList<>(items.size());
        for (T item : items)
            hashed.add(new HashedObject<>(item));

        hashed.sort((a, b) -> {
            int res = order.compare(a.obj, b.obj);
            return res != 0 ? res : HASH_ORDER.compare(a.hash, b.hash);
        });

        ListIterator<T> it = items.listIterator();
        for (HashedObject<T> entry : hashed) {
            it.next();
            it.set(entry.obj);
        }
    }

    private static final class HashedObject<T extends SidechainObject> {
        final T obj;
        final byte[] hash;

        HashedObject(T obj) {
            this.obj = obj;
            this.hash = obj.hash();
        }
    }

    /**
     * Requests to pay out by a new bundle of the given sidechain: the unspent ones, highest fee first,
     * as long as both the count and the sum of amounts and fees stay within the settings limits.
     * Selection stops at the first request which doesn't fit.
     */
    public static List<WithdrawalRequest> selectBundleCandidates(int sidechainNumber,
                                                                 Collection<WithdrawalRequest> requests,
                                                                 BundleSettings settings) {
        List<WithdrawalRequest> candidates = new ArrayList<>();
        for (WithdrawalRequest request : requests) {
            if (request.sidechainNumber() == sidechainNumber)
                candidates.add(request);
        }
        selectUnspent(candidates);
        sortByFee(candidates);

        List<WithdrawalRequest> selected = new ArrayList<>();
        long total = 0;
        for (WithdrawalRequest request : candidates) {
            if (selected.size() >= settings.maxWithdrawals())
                break;
            long value = request.amount() + request.mainchainFee();
            if (total + value > settings.maxAmount())
                break;
            total += value;
            selected.add(request);
        }

        log.debug("Selected {} of {} withdrawal requests for sidechain {}, total {}",
                selected.size(), candidates.size(), sidechainNumber, total);
        return selected;
    }
}
