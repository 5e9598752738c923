package io.horizen.drivechain.model;

import io.horizen.drivechain.fixtures.SidechainObjectFixture;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.CoinsUtils;
import org.junit.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.Assert.*;

public class SidechainObjectCodecTest extends SidechainObjectFixture {

    private static final String WITHDRAWAL_HEX = "5700096d536f6d654164647200e1f5050000000040420f0000000000750000000000000000000000000000000000000000000000000000000000000000";
    private static final String DEPOSIT_HEX = "4401333333333333333333333333333333333333333380b2e60e00000000" + SEGWIT_TX_BASE_HEX + "00000000";
    private static final String BUNDLE_HEX = "5002" + SEGWIT_TX_HEX + "63";

    @Test
    public void encodeWithdrawalRequest() {
        WithdrawalRequest request = getWithdrawalRequest(1000000);
        byte[] bytes = SidechainObjectCodec.encode(request);

        assertEquals("Encoded withdrawal request expected to be equal", WITHDRAWAL_HEX, BytesUtils.toHexString(bytes));
        assertEquals("Tag expected as the first byte", SidechainObjectType.WithdrawalOp.id(), bytes[0]);
        assertArrayEquals("Fields expected after the tag", request.bytes(), Arrays.copyOfRange(bytes, 1, bytes.length));
    }

    @Test
    public void encodeWithdrawalBundle() {
        WithdrawalBundle bundle = getWithdrawalBundle(2, 500);
        assertEquals("Encoded bundle expected to be equal", BUNDLE_HEX, BytesUtils.toHexString(SidechainObjectCodec.encode(bundle)));
    }

    @Test
    public void encodeDeposit() {
        assertEquals("Encoded deposit expected to be equal", DEPOSIT_HEX, BytesUtils.toHexString(SidechainObjectCodec.encode(getDeposit())));
    }

    @Test
    public void decodeRoundTrip() {
        SidechainObject[] objects = {
                getWithdrawalRequest(1000000),
                getWithdrawalRequest(7, "", 0, 0, WithdrawalStatus.Spent),
                getWithdrawalRequest(255, "destinação", CoinsUtils.MAX_MONEY, CoinsUtils.MAX_MONEY, WithdrawalStatus.InBundle),
                getWithdrawalBundle(2, 0),
                new WithdrawalBundle(3, getLegacyTransaction(), BundleStatus.Failed),
                getDeposit()
        };

        for (SidechainObject obj : objects) {
            Optional<SidechainObject> decoded = SidechainObjectCodec.decode(SidechainObjectCodec.encode(obj));
            assertTrue("Object expected to be decoded", decoded.isPresent());
            assertEquals("Decoded object expected to be equal", obj, decoded.get());
            assertEquals("Decoded object type expected to be equal", obj.objectType(), decoded.get().objectType());
            assertArrayEquals("Decoded object hash expected to be equal", obj.hash(), decoded.get().hash());
        }
    }

    @Test
    public void decodeUnknownTag() {
        assertFalse("Empty data expected to contain no object", SidechainObjectCodec.decode(new byte[0]).isPresent());

        for (int tag = 0; tag < 256; tag++) {
            if (SidechainObjectType.fromId((byte) tag).isPresent())
                continue;
            byte[] bytes = BytesUtils.fromHexString(WITHDRAWAL_HEX);
            bytes[0] = (byte) tag;
            assertFalse("Unknown tag " + tag + " expected to contain no object", SidechainObjectCodec.decode(bytes).isPresent());
            assertFalse("Unknown tag " + tag + " alone expected to contain no object", SidechainObjectCodec.decode(new byte[]{(byte) tag}).isPresent());
        }
    }

    @Test
    public void decodeTruncatedData() {
        for (String hex : new String[]{WITHDRAWAL_HEX, BUNDLE_HEX, DEPOSIT_HEX}) {
            byte[] bytes = BytesUtils.fromHexString(hex);
            for (int length = 1; length < bytes.length; length++) {
                try {
                    SidechainObjectCodec.decode(Arrays.copyOf(bytes, length));
                    fail("Malformed data exception expected for " + hex + " truncated to " + length + " bytes");
                } catch (MalformedSidechainObjectException e) {
                    assertEquals("Exception expected to name the object type",
                            SidechainObjectType.fromId(bytes[0]).get(), e.objectType());
                }
            }
        }
    }

    @Test
    public void decodeTrailingData() {
        try {
            SidechainObjectCodec.decode(BytesUtils.fromHexString(WITHDRAWAL_HEX + "00"));
            fail("Malformed data exception expected for trailing data");
        } catch (MalformedSidechainObjectException e) {
            assertEquals(SidechainObjectType.WithdrawalOp, e.objectType());
        }
    }

    @Test
    public void decodeInvalidFields() {
        String[] invalid = {
                // unknown withdrawal status 'x'
                WITHDRAWAL_HEX.replace("0000750000", "0000780000"),
                // destination length longer than the data
                "5700ff" + WITHDRAWAL_HEX.substring(6),
                // destination is not valid UTF-8
                "570002c328" + WITHDRAWAL_HEX.substring(24),
                // negative amount
                "5700096d536f6d6541646472ffffffffffffffff" + WITHDRAWAL_HEX.substring(40),
                // unknown bundle status 'z'
                "5002" + SEGWIT_TX_HEX + "7a"
        };

        for (String hex : invalid) {
            boolean exceptionOccurred = false;
            try {
                SidechainObjectCodec.decode(BytesUtils.fromHexString(hex));
            } catch (MalformedSidechainObjectException e) {
                exceptionOccurred = true;
            }
            assertTrue("Malformed data exception expected for " + hex, exceptionOccurred);
        }
    }
}
