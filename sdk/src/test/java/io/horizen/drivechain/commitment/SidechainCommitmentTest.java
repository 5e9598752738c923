package io.horizen.drivechain.commitment;

import io.horizen.drivechain.fixtures.SidechainObjectFixture;
import io.horizen.drivechain.model.BundleStatus;
import io.horizen.drivechain.model.MalformedSidechainObjectException;
import io.horizen.drivechain.model.SidechainObject;
import io.horizen.drivechain.model.SidechainObjectType;
import io.horizen.drivechain.model.WithdrawalBundle;
import io.horizen.drivechain.model.WithdrawalRequest;
import io.horizen.drivechain.model.WithdrawalStatus;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.utils.BytesUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.Assert.*;

public class SidechainCommitmentTest extends SidechainObjectFixture {

    @Test
    public void withdrawalCommitment() {
        WithdrawalRequest request = new WithdrawalRequest(0, "mSomeAddr", 100000000L, 1000000L, WithdrawalStatus.Unspent, new byte[32]);
        byte[] script = SidechainCommitment.build(request);

        assertArrayEquals("Header expected to be OP_RETURN and magic",
                BytesUtils.fromHexString("6aacdcf66f"), Arrays.copyOf(script, SidechainCommitment.HEADER_LENGTH));
        assertEquals("Tag expected right after the header", SidechainObjectType.WithdrawalOp.id(), script[SidechainCommitment.HEADER_LENGTH]);
        assertEquals("Commitment expected to be equal",
                "6aacdcf66f5700096d536f6d654164647200e1f5050000000040420f0000000000750000000000000000000000000000000000000000000000000000000000000000",
                BytesUtils.toHexString(script));

        Optional<SidechainObject> parsed = SidechainCommitment.parse(script);
        assertTrue("Object expected to be parsed", parsed.isPresent());
        WithdrawalRequest parsedRequest = (WithdrawalRequest) parsed.get();
        assertEquals(0, parsedRequest.sidechainNumber());
        assertEquals("mSomeAddr", parsedRequest.destination());
        assertEquals(100000000L, parsedRequest.amount());
        assertEquals(1000000L, parsedRequest.mainchainFee());
        assertEquals(WithdrawalStatus.Unspent, parsedRequest.status());
        assertArrayEquals(new byte[32], parsedRequest.blindedTxHash());
        assertEquals(request, parsedRequest);
    }

    @Test
    public void roundTrip() {
        SidechainObject[] objects = { getWithdrawalRequest(5), getWithdrawalBundle(1, 0), getDeposit() };
        for (SidechainObject obj : objects) {
            byte[] script = SidechainCommitment.build(obj);
            assertTrue("Script expected to be recognized as commitment", SidechainCommitment.isCommitment(script));
            assertEquals("Parsed object expected to be equal", Optional.of(obj), SidechainCommitment.parse(script));
        }
    }

    @Test
    public void notACommitment() {
        String[] scripts = {
                "",
                "6a",
                "6aacdcf6",
                "6aacdcf66f",           // header only, no payload
                "6aacdcf670570000",     // wrong magic
                "6bacdcf66f5700",       // wrong marker
                "76a914000000000000000000000000000000000000000088ac", // P2PKH
                "6aacdcf66f42"          // unknown tag
        };
        for (String hex : scripts) {
            assertFalse("No object expected in " + hex, SidechainCommitment.parse(BytesUtils.fromHexString(hex)).isPresent());
        }
        assertFalse(SidechainCommitment.isCommitment(BytesUtils.fromHexString("6aacdcf6")));
    }

    @Test(expected = MalformedSidechainObjectException.class)
    public void malformedCommitment() {
        byte[] script = SidechainCommitment.build(getDeposit());
        SidechainCommitment.parse(Arrays.copyOf(script, script.length - 1));
    }

    @Test
    public void bundleWithoutTransactionInputs() {
        // WT^ of sidechain 0 with a transaction which has no inputs and one output, status Created.
        byte[] script = BytesUtils.fromHexString("6aacdcf66f" + "50" + "00" +
                "02000000" + "00" + "01" + "00e1f50500000000" + "016a" + "00000000" + "63");
        boolean exceptionOccurred = false;
        try {
            SidechainCommitment.parse(script);
        } catch (MalformedSidechainObjectException e) {
            exceptionOccurred = true;
        }
        assertTrue("Exception expected for transaction without inputs", exceptionOccurred);

        exceptionOccurred = false;
        try {
            new WithdrawalBundle(0, new MainchainTransaction(2, Collections.emptyList(),
                    getLegacyTransaction().outputs(), 0), BundleStatus.Created);
        } catch (IllegalArgumentException e) {
            exceptionOccurred = true;
        }
        assertTrue("Bundle without transaction inputs expected to be rejected", exceptionOccurred);
    }

    @Test
    public void headerIsCopied() {
        byte[] header = SidechainCommitment.header();
        header[0] = 0;
        assertEquals(SidechainCommitment.OP_RETURN, SidechainCommitment.header()[0]);
    }
}
