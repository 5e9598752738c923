package io.horizen.drivechain.model;

import io.horizen.drivechain.fixtures.SidechainObjectFixture;
import io.horizen.drivechain.utils.BytesUtils;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.*;

public class SidechainObjectTest extends SidechainObjectFixture {

    @Test
    public void hashRegression() {
        assertEquals("4841bde2403e81c4692c060b5589cdf75039e29c0cd06bdfcbf2d5e0b040a734",
                BytesUtils.toMainchainHexString(getWithdrawalRequest(1000000).hash()));
        assertEquals("a57a65e5f63b74ddea7d5fb5831629bc1d19a378c27baab8bb17fd3400d85d39",
                BytesUtils.toMainchainHexString(getWithdrawalBundle(2, 0).hash()));
        assertEquals("d7e09035d4ca4f9ea9ca6c34d5437ca6a86a85daf0e64ef6358e81a1885763f4",
                BytesUtils.toMainchainHexString(getDeposit().hash()));
    }

    @Test
    public void hashDeterminismAndSensitivity() {
        WithdrawalRequest request = getWithdrawalRequest(1000000);
        assertArrayEquals("Equal objects expected to have equal hashes",
                request.hash(), getWithdrawalRequest(1000000).hash());

        WithdrawalRequest[] changed = {
                getWithdrawalRequest(1000001),
                getWithdrawalRequest(1, "mSomeAddr", 100000000L, 1000000, WithdrawalStatus.Unspent),
                getWithdrawalRequest(0, "mOtherAddr", 100000000L, 1000000, WithdrawalStatus.Unspent),
                getWithdrawalRequest(0, "mSomeAddr", 100000001L, 1000000, WithdrawalStatus.Unspent),
                getWithdrawalRequest(0, "mSomeAddr", 100000000L, 1000000, WithdrawalStatus.InBundle),
                new WithdrawalRequest(0, "mSomeAddr", 100000000L, 1000000, WithdrawalStatus.Unspent, BytesUtils.fromHexString(
                        "0100000000000000000000000000000000000000000000000000000000000000"))
        };
        for (WithdrawalRequest other : changed) {
            assertNotEquals("Objects expected to be different", request, other);
            assertFalse("Hash expected to change with any field", Arrays.equals(request.hash(), other.hash()));
        }
    }

    @Test
    public void bundleHeightIsNotPartOfIdentity() {
        WithdrawalBundle bundle = getWithdrawalBundle(2, 100);
        WithdrawalBundle observedLater = bundle.withHeight(200);

        assertEquals("Bundles expected to be equal", bundle, observedLater);
        assertArrayEquals("Bundle hashes expected to be equal", bundle.hash(), observedLater.hash());
        assertEquals("Height expected to be updated", 200, observedLater.height());
    }

    @Test
    public void withdrawalRequestToString() {
        String expected = "sidechainop=W\n" +
                "nSidechain=0\n" +
                "destination=mSomeAddr\n" +
                "amount=1.00\n" +
                "mainchainFee=0.01\n" +
                "status=Unspent\n" +
                "hashBlindWTX=0000000000000000000000000000000000000000000000000000000000000000\n";
        assertEquals(expected, getWithdrawalRequest(1000000).toString());
    }

    @Test
    public void withdrawalBundleToString() {
        WithdrawalBundle bundle = new WithdrawalBundle(2, getSegwitTransaction(), BundleStatus.Spent);
        String str = bundle.toString();
        assertTrue(str.startsWith("sidechainop=P\nnSidechain=2\nwtprime=CTransaction(hash=" + SEGWIT_TX_ID.substring(0, 10)));
        assertTrue(str.contains("    CScriptWitness(aabbcc ddeeff00)\n"));
        assertTrue(str.endsWith("\nstatus=Spent\n"));
    }

    @Test
    public void depositToString() {
        String expected = "sidechainop=D\n" +
                "nSidechain=1\n" +
                "keyID=3333333333333333333333333333333333333333\n" +
                "payout=2.50\n" +
                "mainchaintxid=" + SEGWIT_TX_ID + "\n" +
                "n=0\n" +
                "inputs:\n" +
                "COutPoint(1111111111, 1)\n";
        assertEquals(expected, getDeposit().toString());
    }

    @Test
    public void depositOutput() {
        assertEquals(getLegacyTransaction().outputs().get(0), getDeposit().depositOutput().get());

        Deposit outOfRange = new Deposit(1, new byte[20], 1, getLegacyTransaction(), 5);
        assertFalse(outOfRange.depositOutput().isPresent());
    }

    @Test
    public void withdrawalStatusTransitions() {
        WithdrawalRequest request = getWithdrawalRequest(1000000);

        WithdrawalRequest inBundle = request.withStatus(WithdrawalStatus.InBundle);
        assertEquals(WithdrawalStatus.InBundle, inBundle.status());
        assertEquals("Pending - in WT^", inBundle.statusString());
        assertEquals("Original value expected to stay untouched", WithdrawalStatus.Unspent, request.status());

        WithdrawalRequest spent = inBundle.withStatus(WithdrawalStatus.Spent);
        assertEquals("Spent", spent.statusString());

        try {
            inBundle.withStatus(WithdrawalStatus.Unspent);
            fail("Transition back to Unspent expected to be rejected");
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            spent.withStatus(WithdrawalStatus.InBundle);
            fail("Transition from Spent expected to be rejected");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void bundleStatusTransitions() {
        WithdrawalBundle bundle = getWithdrawalBundle(0, 10);
        assertEquals("Created", bundle.statusString());

        WithdrawalBundle failed = bundle.withStatus(BundleStatus.Failed);
        assertEquals("Failed", failed.statusString());
        assertEquals("Height expected to be kept", 10, failed.height());
        assertEquals("Spent", bundle.withStatus(BundleStatus.Spent).statusString());

        try {
            failed.withStatus(BundleStatus.Spent);
            fail("Failed bundle expected to be terminal");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void statusDescriptions() {
        assertEquals("Unspent", WithdrawalStatus.describe((byte) 'u'));
        assertEquals("Pending - in WT^", WithdrawalStatus.describe((byte) 'p'));
        assertEquals("Spent", WithdrawalStatus.describe((byte) 's'));
        assertEquals("Unknown", WithdrawalStatus.describe((byte) 'x'));
        assertEquals("Unknown", WithdrawalStatus.describe((byte) 0));

        assertEquals("Created", BundleStatus.describe((byte) 'c'));
        assertEquals("Failed", BundleStatus.describe((byte) 'f'));
        assertEquals("Spent", BundleStatus.describe((byte) 'o'));
        assertEquals("Unknown", BundleStatus.describe((byte) 's'));
    }

    @Test
    public void constructorValidation() {
        Runnable[] invalid = {
                () -> getWithdrawalRequest(256, "a", 1, 1, WithdrawalStatus.Unspent),
                () -> getWithdrawalRequest(-1, "a", 1, 1, WithdrawalStatus.Unspent),
                () -> getWithdrawalRequest(0, "a", -1, 1, WithdrawalStatus.Unspent),
                () -> getWithdrawalRequest(0, "a", 1, -1, WithdrawalStatus.Unspent),
                () -> new WithdrawalRequest(0, "a", 1, 1, WithdrawalStatus.Unspent, new byte[31]),
                () -> new Deposit(0, new byte[32], 1, getLegacyTransaction(), 0),
                () -> new Deposit(0, new byte[20], 1, getLegacyTransaction(), 0x100000000L),
                () -> new WithdrawalBundle(0, getLegacyTransaction(), BundleStatus.Created, -1)
        };
        for (int i = 0; i < invalid.length; i++) {
            boolean exceptionOccurred = false;
            try {
                invalid[i].run();
            } catch (IllegalArgumentException e) {
                exceptionOccurred = true;
            }
            assertTrue("Exception expected for invalid object " + i, exceptionOccurred);
        }
    }
}
