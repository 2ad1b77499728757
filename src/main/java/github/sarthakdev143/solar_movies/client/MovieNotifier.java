package github.sarthakdev143.solar_movies.client;

public interface MovieNotifier {

    void movieReady(MovieHistoryEntry entry);

    void movieFailed(MovieHistoryEntry entry, String message);
}
