package io.horizen.drivechain.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.horizen.drivechain.commitment.SidechainCommitment;
import io.horizen.drivechain.json.ApplicationJsonSerializer;
import io.horizen.drivechain.model.BundleStatus;
import io.horizen.drivechain.model.Deposit;
import io.horizen.drivechain.model.MalformedSidechainObjectException;
import io.horizen.drivechain.model.SidechainObject;
import io.horizen.drivechain.model.WithdrawalBundle;
import io.horizen.drivechain.model.WithdrawalRequest;
import io.horizen.drivechain.model.WithdrawalStatus;
import io.horizen.drivechain.selection.WithdrawalSelector;
import io.horizen.drivechain.settings.BundleSettings;
import io.horizen.drivechain.tools.utils.Command;
import io.horizen.drivechain.tools.utils.CommandProcessor;
import io.horizen.drivechain.tools.utils.MessagePrinter;
import io.horizen.drivechain.transaction.MainchainTransaction;
import io.horizen.drivechain.transaction.MainchainTransactionSerializer;
import io.horizen.drivechain.utils.BytesUtils;
import io.horizen.drivechain.utils.Utils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class PegToolCommandProcessor extends CommandProcessor {

    public PegToolCommandProcessor(MessagePrinter printer) {
        super(printer);
    }

    @Override
    public void processCommand(String input) throws Exception {
        Command command = parseCommand(input);

        switch(command.name()) {
            case "help":
                printUsageMsg();
                break;
            case "buildwithdrawal":
                processBuildWithdrawal(command.data());
                break;
            case "buildbundle":
                processBuildBundle(command.data());
                break;
            case "builddeposit":
                processBuildDeposit(command.data());
                break;
            case "parsecommitment":
                processParseCommitment(command.data());
                break;
            case "sortbyfee":
                processSortByFee(command.data());
                break;
            case "selectcandidates":
                processSelectCandidates(command.data());
                break;
            default:
                printUnsupportedCommandMsg(command.name());
        }
    }

    @Override
    protected void printUsageMsg() {
        printer.print("Usage:\n" +
                "\tFrom command line: <program name> <command name> [<json data>]\n" +
                "\tFor interactive mode: <command name> [<json data>]\n" +
                "\tRead command arguments from file: <command name> -f <path to file with json data>\n" +
                "Supported commands:\n" +
                "\thelp\n" +
                "\tbuildwithdrawal <arguments>\n" +
                "\tbuildbundle <arguments>\n" +
                "\tbuilddeposit <arguments>\n" +
                "\tparsecommitment <arguments>\n" +
                "\tsortbyfee <arguments>\n" +
                "\tselectcandidates <arguments>\n" +
                "\texit\n"
        );
    }

    private void printBuildWithdrawalUsageMsg(String error) {
        printer.print("Error: " + error);
        printer.print("Usage:\n" +
                "\tbuildwithdrawal {\"sidechain\": 0, \"destination\": \"mc address\", \"amount\": 100000000, " +
                "\"mainchainFee\": 1000000, [\"status\": \"Unspent\"], [\"blindedTxHash\": \"hex\"]}");
    }

    private void processBuildWithdrawal(JsonNode json) {
        WithdrawalRequest request;
        try {
            request = parseWithdrawal(json);
        } catch (IllegalArgumentException e) {
            printBuildWithdrawalUsageMsg(e.getMessage());
            return;
        }
        printCommitment(request);
    }

    private void printBuildBundleUsageMsg(String error) {
        printer.print("Error: " + error);
        printer.print("Usage:\n" +
                "\tbuildbundle {\"sidechain\": 0, \"transaction\": \"mc transaction hex\", [\"status\": \"Created\"]}");
    }

    private void processBuildBundle(JsonNode json) {
        WithdrawalBundle bundle;
        try {
            int sidechain = requiredInt(json, "sidechain");
            MainchainTransaction transaction = parseTransaction(requiredText(json, "transaction"));
            BundleStatus status = json.has("status") ? BundleStatus.valueOf(json.get("status").asText()) : BundleStatus.Created;
            bundle = new WithdrawalBundle(sidechain, transaction, status);
        } catch (IllegalArgumentException e) {
            printBuildBundleUsageMsg(e.getMessage());
            return;
        }
        printCommitment(bundle);
    }

    private void printBuildDepositUsageMsg(String error) {
        printer.print("Error: " + error);
        printer.print("Usage:\n" +
                "\tbuilddeposit {\"sidechain\": 0, \"keyId\": \"hex\" | \"publicKey\": \"hex\", \"payout\": 100000000, " +
                "\"transaction\": \"mc transaction hex\", \"n\": 0}");
    }

    private void processBuildDeposit(JsonNode json) {
        Deposit deposit;
        try {
            int sidechain = requiredInt(json, "sidechain");
            byte[] keyId;
            if (json.has("keyId"))
                keyId = BytesUtils.fromMainchainHexString(requiredText(json, "keyId"));
            else if (json.has("publicKey"))
                keyId = Utils.Ripemd160Sha256Hash(BytesUtils.fromHexString(requiredText(json, "publicKey")));
            else
                throw new IllegalArgumentException("keyId or publicKey is not specified.");
            long payout = requiredLong(json, "payout");
            MainchainTransaction transaction = parseTransaction(requiredText(json, "transaction"));
            long n = requiredLong(json, "n");
            deposit = new Deposit(sidechain, keyId, payout, transaction, n);
        } catch (IllegalArgumentException e) {
            printBuildDepositUsageMsg(e.getMessage());
            return;
        }
        printCommitment(deposit);
    }

    private void processParseCommitment(JsonNode json) throws IOException {
        if(!json.has("script") || !json.get("script").isTextual()) {
            printer.print("Error: script is not specified or has invalid format.");
            printer.print("Usage:\n\tparsecommitment {\"script\": \"hex\"}");
            return;
        }

        byte[] script;
        try {
            script = BytesUtils.fromHexString(json.get("script").asText());
        } catch (IllegalArgumentException e) {
            printer.print("Error: script is not a valid hex string.");
            return;
        }

        Optional<SidechainObject> obj;
        try {
            obj = SidechainCommitment.parse(script);
        } catch (MalformedSidechainObjectException e) {
            printer.print("Error: " + e.getMessage());
            return;
        }

        if (obj.isPresent())
            printer.print(ApplicationJsonSerializer.getInstance().serialize(obj.get()));
        else
            printer.print("Script doesn't contain a sidechain object.");
    }

    private void printWithdrawalsUsageMsg(String command, String error) {
        printer.print("Error: " + error);
        printer.print("Usage:\n" +
                "\t" + command + " {[\"sidechain\": 0,] \"withdrawals\": [{<buildwithdrawal arguments>}, ...]}");
    }

    private void processSortByFee(JsonNode json) throws IOException {
        List<WithdrawalRequest> requests;
        try {
            requests = parseWithdrawals(json);
        } catch (IllegalArgumentException e) {
            printWithdrawalsUsageMsg("sortbyfee", e.getMessage());
            return;
        }
        WithdrawalSelector.sortByFee(requests);
        printer.print(ApplicationJsonSerializer.getInstance().serialize(requests));
    }

    private void processSelectCandidates(JsonNode json) throws IOException {
        List<WithdrawalRequest> selected;
        try {
            int sidechain = requiredInt(json, "sidechain");
            List<WithdrawalRequest> requests = parseWithdrawals(json);
            BundleSettings defaults = BundleSettings.load();
            BundleSettings settings = new BundleSettings(
                    json.has("maxWithdrawals") ? json.get("maxWithdrawals").asInt() : defaults.maxWithdrawals(),
                    json.has("maxAmount") ? json.get("maxAmount").asLong() : defaults.maxAmount());
            selected = WithdrawalSelector.selectBundleCandidates(sidechain, requests, settings);
        } catch (IllegalArgumentException e) {
            printWithdrawalsUsageMsg("selectcandidates", e.getMessage());
            return;
        }
        printer.print(ApplicationJsonSerializer.getInstance().serialize(selected));
    }

    private void printCommitment(SidechainObject obj) {
        ObjectNode resJson = objectMapper.createObjectNode();
        resJson.put("commitment", BytesUtils.toHexString(SidechainCommitment.build(obj)));
        resJson.put("hash", BytesUtils.toMainchainHexString(obj.hash()));
        printer.print(resJson.toString());
    }

    private List<WithdrawalRequest> parseWithdrawals(JsonNode json) {
        if (!json.has("withdrawals") || !json.get("withdrawals").isArray())
            throw new IllegalArgumentException("withdrawals are not specified or have invalid format.");
        List<WithdrawalRequest> requests = new ArrayList<>();
        for (JsonNode node : json.get("withdrawals"))
            requests.add(parseWithdrawal(node));
        return requests;
    }

    private WithdrawalRequest parseWithdrawal(JsonNode json) {
        int sidechain = requiredInt(json, "sidechain");
        String destination = requiredText(json, "destination");
        long amount = requiredLong(json, "amount");
        long fee = requiredLong(json, "mainchainFee");
        WithdrawalStatus status = json.has("status") ? WithdrawalStatus.valueOf(json.get("status").asText()) : WithdrawalStatus.Unspent;
        byte[] blindedTxHash = json.has("blindedTxHash")
                ? BytesUtils.fromMainchainHexString(requiredText(json, "blindedTxHash"))
                : new byte[Utils.SHA256_LENGTH];
        return new WithdrawalRequest(sidechain, destination, amount, fee, status, blindedTxHash);
    }

    private MainchainTransaction parseTransaction(String hex) {
        return MainchainTransactionSerializer.getSerializer().parseBytes(BytesUtils.fromHexString(hex));
    }

    private static int requiredInt(JsonNode json, String field) {
        if (!json.has(field) || !json.get(field).canConvertToInt())
            throw new IllegalArgumentException(field + " is not specified or has invalid format.");
        return json.get(field).asInt();
    }

    private static long requiredLong(JsonNode json, String field) {
        if (!json.has(field) || !json.get(field).canConvertToLong())
            throw new IllegalArgumentException(field + " is not specified or has invalid format.");
        return json.get(field).asLong();
    }

    private static String requiredText(JsonNode json, String field) {
        if (!json.has(field) || !json.get(field).isTextual())
            throw new IllegalArgumentException(field + " is not specified or has invalid format.");
        return json.get(field).asText();
    }
}
