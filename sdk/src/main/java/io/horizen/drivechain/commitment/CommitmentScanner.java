package io.horizen.drivechain.commitment;

import io.horizen.drivechain.model.MalformedSidechainObjectException;
import io.horizen.drivechain.model.SidechainObject;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTxOutput;
import io.horizen.drivechain.utils.BytesUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

// Collects the sidechain objects committed by the outputs of MC transactions.
public final class CommitmentScanner {
    private static final Logger log = LogManager.getLogger(CommitmentScanner.class);

    private CommitmentScanner() {}

    // Objects in outputs order. Outputs with malformed commitments are skipped.
    public static List<SidechainObject> scan(MainchainTransaction transaction) {
        List<SidechainObject> objects = new ArrayList<>();
        List<MainchainTxOutput> outputs = transaction.outputs();
        for (int i = 0; i < outputs.size(); i++) {
            byte[] script = outputs.get(i).scriptPubKey();
            try {
                Optional<SidechainObject> obj = SidechainCommitment.parse(script);
                obj.ifPresent(objects::add);
            } catch (MalformedSidechainObjectException e) {
                log.warn("Skipping malformed sidechain commitment in output {} of transaction {}: {}",
                        i, BytesUtils.toMainchainHexString(transaction.hash()), e.getMessage());
            }
        }
        return objects;
    }

    public static List<SidechainObject> scan(List<MainchainTransaction> transactions) {
        List<SidechainObject> objects = new ArrayList<>();
        for (MainchainTransaction transaction : transactions)
            objects.addAll(scan(transaction));
        return objects;
    }
}
