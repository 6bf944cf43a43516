package com.work.federation.config;

import com.work.federation.model.ProviderCapability;
import com.work.federation.model.ServiceEndpoint;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 联邦协商配置（本域身份、协商超时、provider 能力、协作方适配器）。
 */
@ConfigurationProperties(prefix = "federation")
public class FederationProperties {

    /**
     * 注册到账本的域名称（bytes32，最长 32 字节）。
     */
    private String domainName = "domain1";

    /**
     * 启动时若尚未注册则自动注册。
     */
    private boolean autoRegister = false;

    /**
     * 运行记录存储：memory 或 postgres
     */
    private String storage = "memory";

    private Lock lock = new Lock();
    private Events events = new Events();
    private Negotiation negotiation = new Negotiation();
    private Provider provider = new Provider();
    private Consumer consumer = new Consumer();
    private Deployment deployment = new Deployment();
    private Network network = new Network();

    public String getDomainName() {
        return domainName;
    }

    public void setDomainName(String domainName) {
        this.domainName = domainName;
    }

    public boolean isAutoRegister() {
        return autoRegister;
    }

    public void setAutoRegister(boolean autoRegister) {
        this.autoRegister = autoRegister;
    }

    public String getStorage() {
        return storage;
    }

    public void setStorage(String storage) {
        this.storage = storage;
    }

    public Lock getLock() {
        return lock;
    }

    public void setLock(Lock lock) {
        this.lock = lock;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public Negotiation getNegotiation() {
        return negotiation;
    }

    public void setNegotiation(Negotiation negotiation) {
        this.negotiation = negotiation;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public void setConsumer(Consumer consumer) {
        this.consumer = consumer;
    }

    public Deployment getDeployment() {
        return deployment;
    }

    public void setDeployment(Deployment deployment) {
        this.deployment = deployment;
    }

    public Network getNetwork() {
        return network;
    }

    public void setNetwork(Network network) {
        this.network = network;
    }

    public static class Lock {

        /**
         * 同一账户被多个进程共享时开启 Redis 提交锁。
         */
        private boolean redisEnabled = false;

        private Duration ttl = Duration.ofSeconds(30);

        /**
         * 获取提交锁的最长等待时间。
         */
        private Duration wait = Duration.ofSeconds(10);

        public boolean isRedisEnabled() {
            return redisEnabled;
        }

        public void setRedisEnabled(boolean redisEnabled) {
            this.redisEnabled = redisEnabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getWait() {
            return wait;
        }

        public void setWait(Duration wait) {
            this.wait = wait;
        }
    }

    public static class Events {

        /**
         * 列表类接口回看的区块数。
         */
        private long lookbackBlocks = 20L;

        private long dedupeMaxSize = 10_000L;

        private Duration dedupeTtl = Duration.ofHours(1);

        public long getLookbackBlocks() {
            return lookbackBlocks;
        }

        public void setLookbackBlocks(long lookbackBlocks) {
            this.lookbackBlocks = lookbackBlocks;
        }

        public long getDedupeMaxSize() {
            return dedupeMaxSize;
        }

        public void setDedupeMaxSize(long dedupeMaxSize) {
            this.dedupeMaxSize = dedupeMaxSize;
        }

        public Duration getDedupeTtl() {
            return dedupeTtl;
        }

        public void setDedupeTtl(Duration dedupeTtl) {
            this.dedupeTtl = dedupeTtl;
        }
    }

    public static class Negotiation {

        /**
         * 异步协商运行的线程数。
         */
        private int workers = 4;

        private Duration pollInitial = Duration.ofMillis(500);

        private Duration pollMax = Duration.ofSeconds(5);

        /**
         * consumer 需要等到的报价数（quorum）。
         */
        private int serviceProviders = 1;

        private Duration bidTimeout = Duration.ofMinutes(10);

        private Duration closureTimeout = Duration.ofMinutes(10);

        private Duration deploymentTimeout = Duration.ofMinutes(15);

        private Duration discoveryTimeout = Duration.ofMinutes(10);

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public Duration getPollInitial() {
            return pollInitial;
        }

        public void setPollInitial(Duration pollInitial) {
            this.pollInitial = pollInitial;
        }

        public Duration getPollMax() {
            return pollMax;
        }

        public void setPollMax(Duration pollMax) {
            this.pollMax = pollMax;
        }

        public int getServiceProviders() {
            return serviceProviders;
        }

        public void setServiceProviders(int serviceProviders) {
            this.serviceProviders = serviceProviders;
        }

        public Duration getBidTimeout() {
            return bidTimeout;
        }

        public void setBidTimeout(Duration bidTimeout) {
            this.bidTimeout = bidTimeout;
        }

        public Duration getClosureTimeout() {
            return closureTimeout;
        }

        public void setClosureTimeout(Duration closureTimeout) {
            this.closureTimeout = closureTimeout;
        }

        public Duration getDeploymentTimeout() {
            return deploymentTimeout;
        }

        public void setDeploymentTimeout(Duration deploymentTimeout) {
            this.deploymentTimeout = deploymentTimeout;
        }

        public Duration getDiscoveryTimeout() {
            return discoveryTimeout;
        }

        public void setDiscoveryTimeout(Duration discoveryTimeout) {
            this.discoveryTimeout = discoveryTimeout;
        }
    }

    public static class Provider {

        private String serviceType = "k8s_deployment";

        /**
         * 报价（€/hour，整数）。
         */
        private BigInteger price = BigInteger.TEN;

        private Double maxBandwidthGbps;

        private Integer minRttLatencyMs;

        private Integer maxComputeCpus;

        private Integer maxComputeRamGb;

        private Endpoint endpoint = new Endpoint();

        public ProviderCapability toCapability() {
            return new ProviderCapability(serviceType, maxBandwidthGbps, minRttLatencyMs, maxComputeCpus, maxComputeRamGb);
        }

        public String getServiceType() {
            return serviceType;
        }

        public void setServiceType(String serviceType) {
            this.serviceType = serviceType;
        }

        public BigInteger getPrice() {
            return price;
        }

        public void setPrice(BigInteger price) {
            this.price = price;
        }

        public Double getMaxBandwidthGbps() {
            return maxBandwidthGbps;
        }

        public void setMaxBandwidthGbps(Double maxBandwidthGbps) {
            this.maxBandwidthGbps = maxBandwidthGbps;
        }

        public Integer getMinRttLatencyMs() {
            return minRttLatencyMs;
        }

        public void setMinRttLatencyMs(Integer minRttLatencyMs) {
            this.minRttLatencyMs = minRttLatencyMs;
        }

        public Integer getMaxComputeCpus() {
            return maxComputeCpus;
        }

        public void setMaxComputeCpus(Integer maxComputeCpus) {
            this.maxComputeCpus = maxComputeCpus;
        }

        public Integer getMaxComputeRamGb() {
            return maxComputeRamGb;
        }

        public void setMaxComputeRamGb(Integer maxComputeRamGb) {
            this.maxComputeRamGb = maxComputeRamGb;
        }

        public Endpoint getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(Endpoint endpoint) {
            this.endpoint = endpoint;
        }
    }

    public static class Consumer {

        private Endpoint endpoint = new Endpoint();

        public Endpoint getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(Endpoint endpoint) {
            this.endpoint = endpoint;
        }
    }

    public static class Endpoint {

        private String serviceCatalogDb;
        private String topologyDb;
        private String nsdId;
        private String nsId;

        public ServiceEndpoint toEndpoint() {
            return new ServiceEndpoint(serviceCatalogDb, topologyDb, nsdId, nsId);
        }

        public String getServiceCatalogDb() {
            return serviceCatalogDb;
        }

        public void setServiceCatalogDb(String serviceCatalogDb) {
            this.serviceCatalogDb = serviceCatalogDb;
        }

        public String getTopologyDb() {
            return topologyDb;
        }

        public void setTopologyDb(String topologyDb) {
            this.topologyDb = topologyDb;
        }

        public String getNsdId() {
            return nsdId;
        }

        public void setNsdId(String nsdId) {
            this.nsdId = nsdId;
        }

        public String getNsId() {
            return nsId;
        }

        public void setNsId(String nsId) {
            this.nsId = nsId;
        }
    }

    public static class Deployment {

        /**
         * 部署完成后对外暴露的 federated host（StaticDeploymentConnector 直接返回）。
         */
        private String federatedHost = "192.168.70.10";

        private int replicas = 1;

        public String getFederatedHost() {
            return federatedHost;
        }

        public void setFederatedHost(String federatedHost) {
            this.federatedHost = federatedHost;
        }

        public int getReplicas() {
            return replicas;
        }

        public void setReplicas(int replicas) {
            this.replicas = replicas;
        }
    }

    public static class Network {

        /**
         * logging: 只记录日志；router: 调用本地路由器 API 的 /configure_router
         */
        private String mode = "logging";

        private String routerUrl = "http://localhost:9999";

        private String routerPassword;

        private String localIp;

        private String remoteIp;

        private String interfaceName = "eno1";

        private int vni = 49;

        private int udpPort = 4789;

        /**
         * 各域共享的联邦网段；对端子网由 peerSubnetId 替换第三段得到。
         */
        private String federationNet = "10.0.0.0/16";

        private int peerSubnetId = 2;

        private String tunnelIp = "172.28.0.1/30";

        private String gatewayIp = "172.28.0.2";

        private Duration requestTimeout = Duration.ofSeconds(10);

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public String getRouterUrl() {
            return routerUrl;
        }

        public void setRouterUrl(String routerUrl) {
            this.routerUrl = routerUrl;
        }

        public String getRouterPassword() {
            return routerPassword;
        }

        public void setRouterPassword(String routerPassword) {
            this.routerPassword = routerPassword;
        }

        public String getLocalIp() {
            return localIp;
        }

        public void setLocalIp(String localIp) {
            this.localIp = localIp;
        }

        public String getRemoteIp() {
            return remoteIp;
        }

        public void setRemoteIp(String remoteIp) {
            this.remoteIp = remoteIp;
        }

        public String getInterfaceName() {
            return interfaceName;
        }

        public void setInterfaceName(String interfaceName) {
            this.interfaceName = interfaceName;
        }

        public int getVni() {
            return vni;
        }

        public void setVni(int vni) {
            this.vni = vni;
        }

        public int getUdpPort() {
            return udpPort;
        }

        public void setUdpPort(int udpPort) {
            this.udpPort = udpPort;
        }

        public String getFederationNet() {
            return federationNet;
        }

        public void setFederationNet(String federationNet) {
            this.federationNet = federationNet;
        }

        public int getPeerSubnetId() {
            return peerSubnetId;
        }

        public void setPeerSubnetId(int peerSubnetId) {
            this.peerSubnetId = peerSubnetId;
        }

        public String getTunnelIp() {
            return tunnelIp;
        }

        public void setTunnelIp(String tunnelIp) {
            this.tunnelIp = tunnelIp;
        }

        public String getGatewayIp() {
            return gatewayIp;
        }

        public void setGatewayIp(String gatewayIp) {
            this.gatewayIp = gatewayIp;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
