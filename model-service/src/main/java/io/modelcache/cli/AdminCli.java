package io.modelcache.cli;

import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.util.JsonFormat;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Metadata;
import io.grpc.StatusRuntimeException;
import io.modelcache.grpc.Empty;
import io.modelcache.grpc.ModelAdminGrpc;
import io.modelcache.grpc.ModelAdminServer;
import io.modelcache.grpc.SelectRequest;
import io.modelcache.grpc.TaskRequest;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Operator CLI talking to the gRPC admin service. Prints the reply as JSON; exits 1 when the server reports an
 * error and 2 on bad usage.
 */
@CommandLine.Command(name = "model-admin", mixinStandardHelpOptions = true,
        description = "Inspect and control the model resource manager",
        subcommands = {
                AdminCli.Config.class,
                AdminCli.Status.class,
                AdminCli.Select.class,
                AdminCli.Validate.class,
                AdminCli.Load.class,
                AdminCli.Unload.class,
                AdminCli.Health.class
        })
public final class AdminCli implements Callable<Integer> {
    private static final JsonFormat.Printer PRINTER = JsonFormat.printer()
            .preservingProtoFieldNames()
            .includingDefaultValueFields();

    @CommandLine.Option(names = {"-H", "--host"}, description = "Admin host", defaultValue = "127.0.0.1")
    String host;

    @CommandLine.Option(names = {"-p", "--port"}, description = "gRPC admin port",
            defaultValue = "${env:MODELCACHE_GRPC_PORT:-8081}")
    int port;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(execute(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true)));
    }

    static int execute(String[] args, PrintWriter out, PrintWriter err) {
        CommandLine cmd = new CommandLine(new AdminCli());
        cmd.setOut(out);
        cmd.setErr(err);
        return cmd.execute(args);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    int invoke(Function<ModelAdminGrpc.ModelAdminBlockingStub, MessageOrBuilder> call) throws Exception {
        ManagedChannel ch = ManagedChannelBuilder.forAddress(host, port).usePlaintext().build();
        try {
            MessageOrBuilder reply = call.apply(ModelAdminGrpc.newBlockingStub(ch).withDeadlineAfter(60, TimeUnit.SECONDS));
            spec.commandLine().getOut().println(PRINTER.print(reply));
            return CommandLine.ExitCode.OK;
        } catch (StatusRuntimeException e) {
            Metadata trailers = e.getTrailers();
            String kind = trailers == null ? null : trailers.get(ModelAdminServer.ERROR_KIND);
            spec.commandLine().getErr().printf("{\"error\":\"%s\",\"message\":\"%s\"}%n",
                    kind != null ? kind : e.getStatus().getCode().name(),
                    escape(e.getStatus().getDescription()));
            return CommandLine.ExitCode.SOFTWARE;
        } finally {
            ch.shutdownNow();
        }
    }

    private static String escape(String s) {
        return s == null ? "" : s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    abstract static class Sub implements Callable<Integer> {
        @CommandLine.ParentCommand
        AdminCli parent;
    }

    @CommandLine.Command(name = "config", description = "Show tasks, options and inference settings")
    static class Config extends Sub {
        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.getConfig(Empty.getDefaultInstance()));
        }
    }

    @CommandLine.Command(name = "status", description = "Show loaded resources and memory use")
    static class Status extends Sub {
        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.getStatus(Empty.getDefaultInstance()));
        }
    }

    @CommandLine.Command(name = "select", description = "Change the selected option of a task")
    static class Select extends Sub {
        @CommandLine.Parameters(index = "0", description = "Task id")
        String task;

        @CommandLine.Parameters(index = "1", description = "Option name")
        String option;

        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.select(SelectRequest.newBuilder().setTaskId(task).setOption(option).build()));
        }
    }

    @CommandLine.Command(name = "validate", description = "Check the selected options against the memory budget")
    static class Validate extends Sub {
        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.validateBudget(Empty.getDefaultInstance()));
        }
    }

    @CommandLine.Command(name = "load", description = "Load a task's selected option")
    static class Load extends Sub {
        @CommandLine.Parameters(index = "0", description = "Task id")
        String task;

        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.load(TaskRequest.newBuilder().setTaskId(task).build()));
        }
    }

    @CommandLine.Command(name = "unload", description = "Unload a task's resource")
    static class Unload extends Sub {
        @CommandLine.Parameters(index = "0", description = "Task id")
        String task;

        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.unload(TaskRequest.newBuilder().setTaskId(task).build()));
        }
    }

    @CommandLine.Command(name = "health", description = "Report readiness")
    static class Health extends Sub {
        @Override
        public Integer call() throws Exception {
            return parent.invoke(stub -> stub.health(Empty.getDefaultInstance()));
        }
    }
}
