package io.modelcache.grpc;

import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.grpc.stub.StreamObserver;
import io.modelcache.admin.ModelAdmin;
import io.modelcache.error.ErrorKind;
import io.modelcache.error.ResourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * gRPC front end for {@link ModelAdmin}. Typed failures become the status code of their {@link ErrorKind}, with
 * the kind name in the {@code error-kind} trailer.
 */
public class ModelAdminServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModelAdminServer.class);

    public static final Metadata.Key<String> ERROR_KIND =
            Metadata.Key.of("error-kind", Metadata.ASCII_STRING_MARSHALLER);

    private final Server server;

    public ModelAdminServer(int port, ModelAdmin admin) {
        this.server = ServerBuilder.forPort(port)
                .addService(new ServiceImpl(admin))
                .addService(ProtoReflectionService.newInstance())
                .build();
    }

    public void start() throws IOException {
        server.start();
        log.info("gRPC admin listening on {}", server.getPort());
    }

    /** The bound port; differs from the requested one when that was 0. */
    public int port() { return server.getPort(); }

    @Override
    public void close() { server.shutdownNow(); }

    static StatusRuntimeException toStatus(ResourceException e) {
        ErrorKind kind = e.kind();
        Metadata trailers = new Metadata();
        trailers.put(ERROR_KIND, kind.name());
        return Status.fromCode(Status.Code.valueOf(kind.grpcCode()))
                .withDescription(e.getMessage())
                .withCause(e)
                .asRuntimeException(trailers);
    }

    @FunctionalInterface
    private interface Call<T> {
        T run() throws ResourceException, InterruptedException;
    }

    private static class ServiceImpl extends ModelAdminGrpc.ModelAdminImplBase {
        private final ModelAdmin admin;

        ServiceImpl(ModelAdmin admin) { this.admin = admin; }

        @Override
        public void getConfig(Empty request, StreamObserver<ModelConfig> responseObserver) {
            reply(responseObserver, admin::config);
        }

        @Override
        public void getStatus(Empty request, StreamObserver<ModelStatus> responseObserver) {
            reply(responseObserver, admin::status);
        }

        @Override
        public void select(SelectRequest request, StreamObserver<SelectResponse> responseObserver) {
            reply(responseObserver, () -> admin.select(request.getTaskId(), request.getOption()));
        }

        @Override
        public void validateBudget(Empty request, StreamObserver<BudgetValidation> responseObserver) {
            reply(responseObserver, admin::validateBudget);
        }

        @Override
        public void load(TaskRequest request, StreamObserver<ActionResponse> responseObserver) {
            reply(responseObserver, () -> admin.load(request.getTaskId()));
        }

        @Override
        public void unload(TaskRequest request, StreamObserver<ActionResponse> responseObserver) {
            reply(responseObserver, () -> admin.unload(request.getTaskId()));
        }

        @Override
        public void health(Empty request, StreamObserver<HealthStatus> responseObserver) {
            reply(responseObserver, admin::health);
        }

        private <T> void reply(StreamObserver<T> responseObserver, Call<T> call) {
            T resp;
            try {
                resp = call.run();
            } catch (ResourceException e) {
                log.warn("Admin call failed: {}", e.getMessage());
                responseObserver.onError(toStatus(e));
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                responseObserver.onError(Status.CANCELLED.withDescription("interrupted").asRuntimeException());
                return;
            } catch (IllegalStateException e) {
                responseObserver.onError(Status.UNAVAILABLE.withDescription(e.getMessage()).asRuntimeException());
                return;
            }
            responseObserver.onNext(resp);
            responseObserver.onCompleted();
        }
    }
}
